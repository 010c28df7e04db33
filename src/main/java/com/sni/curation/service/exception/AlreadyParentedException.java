package com.sni.curation.service.exception;

import java.util.UUID;

/**
 * Raised when assigning a parent to a narrative that already has one. The existing link must be cleared first.
 */
public class AlreadyParentedException extends CurationException {

    private final UUID childId;
    private final UUID currentParentId;

    public AlreadyParentedException(UUID childId, UUID currentParentId) {
        super("ALREADY_PARENTED", "Narrative " + childId + " is already assigned to parent " + currentParentId);
        this.childId = childId;
        this.currentParentId = currentParentId;
    }

    public UUID getChildId() {
        return childId;
    }

    public UUID getCurrentParentId() {
        return currentParentId;
    }
}
