package com.sni.curation.service.exception;

/**
 * Base type for every rejection the curation core reports to its callers.
 */
public abstract class CurationException extends RuntimeException {

    private final String errorCode;

    /**
     * Creates an exception with a stable machine-readable code.
     */
    protected CurationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * Creates an exception that preserves the originating cause.
     */
    protected CurationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
