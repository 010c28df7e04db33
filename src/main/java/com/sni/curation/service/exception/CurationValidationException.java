package com.sni.curation.service.exception;

/**
 * Malformed input, e.g. a priority outside [1, 5] or a status that does not fit the narrative's provenance.
 */
public class CurationValidationException extends CurationException {

    public CurationValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
