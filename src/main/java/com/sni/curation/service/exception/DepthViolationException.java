package com.sni.curation.service.exception;

/**
 * Raised when a parent assignment would create a hierarchy deeper than parent and child.
 */
public class DepthViolationException extends CurationException {

    public static final int MAX_DEPTH = 2;

    public DepthViolationException(String message) {
        super("DEPTH_VIOLATION", message);
    }

    public int getMaxDepth() {
        return MAX_DEPTH;
    }
}
