package com.sni.curation.dto;

import jakarta.validation.constraints.NotBlank;

public class ApproveClusterGroupRequest {

    @NotBlank
    private String reviewerId;

    private String notes;

    public String getReviewerId() {
        return reviewerId;
    }

    public void setReviewerId(String reviewerId) {
        this.reviewerId = reviewerId;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
