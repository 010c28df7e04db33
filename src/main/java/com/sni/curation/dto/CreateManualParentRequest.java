package com.sni.curation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

public class CreateManualParentRequest {

    @NotBlank
    @Size(min = 10, max = 500)
    private String title;

    @NotBlank
    @Size(min = 50)
    private String summary;

    @NotBlank
    private String curatorId;

    private List<String> clusterIds;

    @Min(1)
    @Max(5)
    private Integer editorialPriority;

    private String confidenceRating;

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public String getCuratorId() {
        return curatorId;
    }

    public void setCuratorId(String curatorId) {
        this.curatorId = curatorId;
    }

    public List<String> getClusterIds() {
        return clusterIds;
    }

    public void setClusterIds(List<String> clusterIds) {
        this.clusterIds = clusterIds;
    }

    public Integer getEditorialPriority() {
        return editorialPriority;
    }

    public void setEditorialPriority(Integer editorialPriority) {
        this.editorialPriority = editorialPriority;
    }

    public String getConfidenceRating() {
        return confidenceRating;
    }

    public void setConfidenceRating(String confidenceRating) {
        this.confidenceRating = confidenceRating;
    }
}
