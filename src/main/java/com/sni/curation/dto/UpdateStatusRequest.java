package com.sni.curation.dto;

import com.sni.curation.model.CurationStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public class UpdateStatusRequest {

    @NotNull
    private CurationStatus newStatus;

    @NotBlank
    private String actorId;

    private String notes;

    private Long expectedVersion;

    /**
     * Returns the requested status.
     */
    public CurationStatus getNewStatus() {
        return newStatus;
    }

    /**
     * Sets the requested status.
     */
    public void setNewStatus(CurationStatus newStatus) {
        this.newStatus = newStatus;
    }

    /**
     * Returns the actor making the change.
     */
    public String getActorId() {
        return actorId;
    }

    /**
     * Sets the actor making the change.
     */
    public void setActorId(String actorId) {
        this.actorId = actorId;
    }

    /**
     * Returns the optional notes about the change.
     */
    public String getNotes() {
        return notes;
    }

    /**
     * Sets the optional notes about the change.
     */
    public void setNotes(String notes) {
        this.notes = notes;
    }

    /**
     * Returns the version the caller last read; stale versions are rejected.
     */
    public Long getExpectedVersion() {
        return expectedVersion;
    }

    /**
     * Sets the version the caller last read; stale versions are rejected.
     */
    public void setExpectedVersion(Long expectedVersion) {
        this.expectedVersion = expectedVersion;
    }
}
