package com.sni.curation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public class UpdatePriorityRequest {

    @NotNull
    @Min(1)
    @Max(5)
    private Integer editorialPriority;

    @NotBlank
    private String actorId;

    private String reason;

    public Integer getEditorialPriority() {
        return editorialPriority;
    }

    public void setEditorialPriority(Integer editorialPriority) {
        this.editorialPriority = editorialPriority;
    }

    public String getActorId() {
        return actorId;
    }

    public void setActorId(String actorId) {
        this.actorId = actorId;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
