package com.sni.curation.service.exception;

/**
 * Raised when a writer lost a race on the same row (stale expected version or optimistic lock failure).
 */
public class ConcurrentNarrativeModificationException extends CurationException {

    public ConcurrentNarrativeModificationException(String message) {
        super("CONCURRENT_MODIFICATION", message);
    }

    public ConcurrentNarrativeModificationException(String message, Throwable cause) {
        super("CONCURRENT_MODIFICATION", message, cause);
    }
}
