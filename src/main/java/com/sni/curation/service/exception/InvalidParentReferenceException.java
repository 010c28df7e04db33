package com.sni.curation.service.exception;

public class InvalidParentReferenceException extends CurationException {

    public InvalidParentReferenceException(String message) {
        super("INVALID_PARENT_REFERENCE", message);
    }
}
