package com.sni.curation.dto;

import com.sni.curation.model.CurationSource;
import com.sni.curation.model.CurationStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Root narrative handed over by the pipeline producer.
 */
public class CreateNarrativeRequest {

    @NotBlank
    private String title;

    private String summary;

    private String narrativeId;

    private String confidenceRating;

    private CurationSource curationSource;

    private CurationStatus curationStatus;

    @Min(1)
    @Max(5)
    private Integer editorialPriority;

    private String actorId;

    /**
     * Returns the narrative title.
     */
    public String getTitle() {
        return title;
    }

    /**
     * Sets the narrative title.
     */
    public void setTitle(String title) {
        this.title = title;
    }

    /**
     * Returns the narrative summary.
     */
    public String getSummary() {
        return summary;
    }

    /**
     * Sets the narrative summary.
     */
    public void setSummary(String summary) {
        this.summary = summary;
    }

    /**
     * Returns the display id, generated when absent.
     */
    public String getNarrativeId() {
        return narrativeId;
    }

    /**
     * Sets the display id, generated when absent.
     */
    public void setNarrativeId(String narrativeId) {
        this.narrativeId = narrativeId;
    }

    /**
     * Returns the confidence rating.
     */
    public String getConfidenceRating() {
        return confidenceRating;
    }

    /**
     * Sets the confidence rating.
     */
    public void setConfidenceRating(String confidenceRating) {
        this.confidenceRating = confidenceRating;
    }

    /**
     * Returns the provenance, defaults to pipeline.
     */
    public CurationSource getCurationSource() {
        return curationSource;
    }

    /**
     * Sets the provenance, defaults to pipeline.
     */
    public void setCurationSource(CurationSource curationSource) {
        this.curationSource = curationSource;
    }

    /**
     * Returns the initial status, defaults to the provenance's entry state.
     */
    public CurationStatus getCurationStatus() {
        return curationStatus;
    }

    /**
     * Sets the initial status, defaults to the provenance's entry state.
     */
    public void setCurationStatus(CurationStatus curationStatus) {
        this.curationStatus = curationStatus;
    }

    /**
     * Returns the editorial priority.
     */
    public Integer getEditorialPriority() {
        return editorialPriority;
    }

    /**
     * Sets the editorial priority.
     */
    public void setEditorialPriority(Integer editorialPriority) {
        this.editorialPriority = editorialPriority;
    }

    /**
     * Returns the producer identifier recorded in the audit log.
     */
    public String getActorId() {
        return actorId;
    }

    /**
     * Sets the producer identifier recorded in the audit log.
     */
    public void setActorId(String actorId) {
        this.actorId = actorId;
    }
}
