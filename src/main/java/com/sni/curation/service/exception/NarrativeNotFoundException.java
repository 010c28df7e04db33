package com.sni.curation.service.exception;

public class NarrativeNotFoundException extends CurationException {

    public NarrativeNotFoundException(String message) {
        super("NOT_FOUND", message);
    }
}
