package com.sni.curation.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Curator-defined grouping of opaque external cluster ids that justifies a manual parent narrative.
 */
@Entity
@Table(name = "manual_cluster_groups")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualClusterGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "group_name", nullable = false)
    private String name;

    @Column(name = "group_description", columnDefinition = "TEXT")
    private String description;

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "cluster_ids", columnDefinition = "jsonb", nullable = false)
    private List<String> clusterIds = new ArrayList<>();

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "cluster_metadata", columnDefinition = "jsonb")
    private Map<String, Object> clusterMetadata = new HashMap<>();

    @Column(name = "parent_narrative_id")
    private UUID parentNarrativeId;

    @Column(name = "curator_id", nullable = false, length = 100)
    private String curatorId;

    @Column(name = "curation_rationale", columnDefinition = "TEXT")
    private String rationale;

    @Column(name = "strategic_significance", columnDefinition = "TEXT")
    private String strategicSignificance;

    @Convert(converter = ClusterGroupStatusConverter.class)
    @Column(name = "status", nullable = false, length = 50)
    private ClusterGroupStatus status;

    @Column(name = "reviewer_id", length = 100)
    private String reviewerId;

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "review_notes", columnDefinition = "jsonb")
    private List<CurationNote> reviewNotes = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Column(name = "approved_at")
    private OffsetDateTime approvedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public void appendReviewNote(CurationNote note) {
        if (reviewNotes == null) {
            reviewNotes = new ArrayList<>();
        }
        reviewNotes.add(note);
    }
}
