package com.sni.curation.controller;

import com.sni.curation.service.exception.ConcurrentNarrativeModificationException;
import com.sni.curation.service.exception.CurationException;
import com.sni.curation.service.exception.DepthViolationException;
import com.sni.curation.service.exception.InvalidTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps curation failures to HTTP responses with a {@code {error, code, message}} body.
 */
@RestControllerAdvice
public class CurationExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(CurationExceptionHandler.class);

    @ExceptionHandler(CurationException.class)
    public ResponseEntity<Map<String, Object>> handleCurationException(CurationException e) {
        HttpStatus status = statusFor(e.getErrorCode());
        logger.warn("Curation request rejected ({}): {}", e.getErrorCode(), e.getMessage());

        Map<String, Object> errorResponse = body(status, e.getErrorCode(), e.getMessage());
        if (e instanceof InvalidTransitionException transition) {
            errorResponse.put("from", transition.getFrom());
            errorResponse.put("to", transition.getTo());
        }
        if (e instanceof DepthViolationException depth) {
            errorResponse.put("maxDepth", depth.getMaxDepth());
        }
        return ResponseEntity.status(status).body(errorResponse);
    }

    /**
     * A concurrent writer committed first and bumped the row version.
     */
    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<Map<String, Object>> handleOptimisticLock(ObjectOptimisticLockingFailureException e) {
        logger.warn("Optimistic lock failure: {}", e.getMessage());
        ConcurrentNarrativeModificationException wrapped =
                new ConcurrentNarrativeModificationException("The record was modified concurrently; reload and retry", e);
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(body(HttpStatus.CONFLICT, wrapped.getErrorCode(), wrapped.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(CurationExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        logger.warn("Invalid request body: {}", message);
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, Object>> handleMalformedRequest(Exception e) {
        logger.warn("Malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneralException(Exception e) {
        logger.error("Unexpected curation failure: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected server error"));
    }

    static HttpStatus statusFor(String errorCode) {
        return switch (errorCode) {
            case "NOT_FOUND" -> HttpStatus.NOT_FOUND;
            case "VALIDATION_ERROR", "SELF_REFERENCE", "INVALID_PARENT_REFERENCE" -> HttpStatus.BAD_REQUEST;
            case "INVALID_TRANSITION", "DEPTH_VIOLATION", "ALREADY_PARENTED", "CONCURRENT_MODIFICATION" ->
                    HttpStatus.CONFLICT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static Map<String, Object> body(HttpStatus status, String code, String message) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", status.getReasonPhrase());
        errorResponse.put("code", code);
        errorResponse.put("message", message);
        return errorResponse;
    }

    private static String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }
}
