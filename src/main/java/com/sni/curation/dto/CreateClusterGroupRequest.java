package com.sni.curation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

/**
 * Curator grouping of external cluster ids.
 */
public class CreateClusterGroupRequest {

    @NotBlank
    @Size(min = 5, max = 255)
    private String name;

    private String description;

    @NotEmpty
    private List<String> clusterIds;

    @NotBlank
    private String curatorId;

    private String rationale;

    private String strategicSignificance;

    private Map<String, Object> clusterMetadata;

    /**
     * Returns the group name.
     */
    public String getName() {
        return name;
    }

    /**
     * Sets the group name.
     */
    public void setName(String name) {
        this.name = name;
    }

    /**
     * Returns the group description.
     */
    public String getDescription() {
        return description;
    }

    /**
     * Sets the group description.
     */
    public void setDescription(String description) {
        this.description = description;
    }

    /**
     * Returns the external cluster ids.
     */
    public List<String> getClusterIds() {
        return clusterIds;
    }

    /**
     * Sets the external cluster ids.
     */
    public void setClusterIds(List<String> clusterIds) {
        this.clusterIds = clusterIds;
    }

    /**
     * Returns the curator creating the group.
     */
    public String getCuratorId() {
        return curatorId;
    }

    /**
     * Sets the curator creating the group.
     */
    public void setCuratorId(String curatorId) {
        this.curatorId = curatorId;
    }

    /**
     * Returns the why these clusters belong together.
     */
    public String getRationale() {
        return rationale;
    }

    /**
     * Sets the why these clusters belong together.
     */
    public void setRationale(String rationale) {
        this.rationale = rationale;
    }

    /**
     * Returns the strategic significance.
     */
    public String getStrategicSignificance() {
        return strategicSignificance;
    }

    /**
     * Sets the strategic significance.
     */
    public void setStrategicSignificance(String strategicSignificance) {
        this.strategicSignificance = strategicSignificance;
    }

    /**
     * Returns the metadata copied from the clusters.
     */
    public Map<String, Object> getClusterMetadata() {
        return clusterMetadata;
    }

    /**
     * Sets the metadata copied from the clusters.
     */
    public void setClusterMetadata(Map<String, Object> clusterMetadata) {
        this.clusterMetadata = clusterMetadata;
    }
}
