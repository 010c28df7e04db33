package com.sni.curation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.Set;

/**
 * Editorial lifecycle state of a narrative.
 *
 * <p>The allowed transitions form a closed table: every (current, requested) pair is answered by
 * {@link #canTransitionTo(CurationStatus)}. Staying in the same state is always allowed.
 */
public enum CurationStatus {

    AUTO_GENERATED("auto_generated"),
    MANUAL_DRAFT("manual_draft"),
    PENDING_REVIEW("pending_review"),
    REVIEWED("reviewed"),
    APPROVED("approved"),
    PUBLISHED("published"),
    ARCHIVED("archived");

    private final String value;

    CurationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Returns the states reachable from this one in a single step, excluding the idempotent self-transition.
     */
    public Set<CurationStatus> allowedTargets() {
        return switch (this) {
            case AUTO_GENERATED -> Sets.immutableEnumSet(PENDING_REVIEW, APPROVED);
            case MANUAL_DRAFT -> Sets.immutableEnumSet(PENDING_REVIEW, ARCHIVED);
            case PENDING_REVIEW -> Sets.immutableEnumSet(REVIEWED, APPROVED, MANUAL_DRAFT);
            case REVIEWED -> Sets.immutableEnumSet(APPROVED, MANUAL_DRAFT, PENDING_REVIEW);
            case APPROVED -> Sets.immutableEnumSet(PUBLISHED, REVIEWED);
            case PUBLISHED -> Sets.immutableEnumSet(ARCHIVED, REVIEWED);
            // No outgoing edges are defined for archived narratives.
            case ARCHIVED -> ImmutableSet.of();
        };
    }

    public boolean canTransitionTo(CurationStatus target) {
        if (target == null) {
            return false;
        }
        return this == target || allowedTargets().contains(target);
    }

    /**
     * Whether a narrative may be created directly in this state.
     */
    public boolean isEntryState() {
        return this == AUTO_GENERATED || this == MANUAL_DRAFT;
    }

    public boolean isAwaitingReview() {
        return this == PENDING_REVIEW || this == REVIEWED;
    }

    @JsonCreator
    public static CurationStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (CurationStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown curation status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
