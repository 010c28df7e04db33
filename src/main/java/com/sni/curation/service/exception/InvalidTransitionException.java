package com.sni.curation.service.exception;

/**
 * Raised when a requested status change is not an edge of the workflow. Nothing is written when this is thrown.
 */
public class InvalidTransitionException extends CurationException {

    private final String from;
    private final String to;

    public InvalidTransitionException(String from, String to) {
        super("INVALID_TRANSITION", "Invalid transition from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }
}
