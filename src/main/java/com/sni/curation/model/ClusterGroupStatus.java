package com.sni.curation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Review state of a manual cluster group. Progresses one step per approval and never moves back.
 */
public enum ClusterGroupStatus {

    DRAFT("draft"),
    PENDING_REVIEW("pending_review"),
    APPROVED("approved");

    private final String value;

    ClusterGroupStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Returns the next stage, or {@code null} once approved.
     */
    public ClusterGroupStatus next() {
        return switch (this) {
            case DRAFT -> PENDING_REVIEW;
            case PENDING_REVIEW -> APPROVED;
            case APPROVED -> null;
        };
    }

    @JsonCreator
    public static ClusterGroupStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ClusterGroupStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown cluster group status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
