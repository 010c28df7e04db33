package com.sni.curation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public class LinkClusterGroupRequest {

    @NotNull
    private UUID parentNarrativeId;

    @NotBlank
    private String actorId;

    public UUID getParentNarrativeId() {
        return parentNarrativeId;
    }

    public void setParentNarrativeId(UUID parentNarrativeId) {
        this.parentNarrativeId = parentNarrativeId;
    }

    public String getActorId() {
        return actorId;
    }

    public void setActorId(String actorId) {
        this.actorId = actorId;
    }
}
