package com.sni.curation.dto;

import jakarta.validation.constraints.NotBlank;

import java.time.OffsetDateTime;

public class ReviewAssignmentRequest {

    @NotBlank
    private String reviewerId;

    private OffsetDateTime reviewDeadline;

    @NotBlank
    private String actorId;

    /**
     * Returns the assigned reviewer.
     */
    public String getReviewerId() {
        return reviewerId;
    }

    /**
     * Sets the assigned reviewer.
     */
    public void setReviewerId(String reviewerId) {
        this.reviewerId = reviewerId;
    }

    /**
     * Returns the review deadline.
     */
    public OffsetDateTime getReviewDeadline() {
        return reviewDeadline;
    }

    /**
     * Sets the review deadline.
     */
    public void setReviewDeadline(OffsetDateTime reviewDeadline) {
        this.reviewDeadline = reviewDeadline;
    }

    /**
     * Returns the actor assigning the review.
     */
    public String getActorId() {
        return actorId;
    }

    /**
     * Sets the actor assigning the review.
     */
    public void setActorId(String actorId) {
        this.actorId = actorId;
    }
}
