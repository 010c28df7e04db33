package com.sni.curation.dto;

import jakarta.validation.constraints.NotBlank;

public class AddNoteRequest {

    @NotBlank
    private String detail;

    @NotBlank
    private String actorId;

    public String getDetail() {
        return detail;
    }

    public void setDetail(String detail) {
        this.detail = detail;
    }

    public String getActorId() {
        return actorId;
    }

    public void setActorId(String actorId) {
        this.actorId = actorId;
    }
}
