package com.sni.curation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.UUID;

public class AssignChildrenRequest {

    @NotEmpty
    private List<UUID> childIds;

    @NotBlank
    private String curatorId;

    private String rationale;

    /**
     * Returns the child narrative ids.
     */
    public List<UUID> getChildIds() {
        return childIds;
    }

    /**
     * Sets the child narrative ids.
     */
    public void setChildIds(List<UUID> childIds) {
        this.childIds = childIds;
    }

    /**
     * Returns the curator performing the assignment.
     */
    public String getCuratorId() {
        return curatorId;
    }

    /**
     * Sets the curator performing the assignment.
     */
    public void setCuratorId(String curatorId) {
        this.curatorId = curatorId;
    }

    /**
     * Returns the assignment rationale.
     */
    public String getRationale() {
        return rationale;
    }

    /**
     * Sets the assignment rationale.
     */
    public void setRationale(String rationale) {
        this.rationale = rationale;
    }
}
