package com.sni.curation.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
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
import java.util.List;
import java.util.UUID;

/**
 * A narrative and its single self-referential parent link. A {@code null} parent marks a root.
 */
@Entity
@Table(name = "narratives")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Narrative {

    @Id
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "narrative_id", nullable = false, unique = true)
    private String narrativeId;

    @Column(name = "parent_id")
    private UUID parentId;

    @Column(name = "title", nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(name = "summary", columnDefinition = "TEXT")
    private String summary;

    @Column(name = "confidence_rating")
    private String confidenceRating;

    @Convert(converter = CurationSourceConverter.class)
    @Column(name = "curation_source", nullable = false)
    private CurationSource curationSource;

    @Convert(converter = CurationStatusConverter.class)
    @Column(name = "curation_status", nullable = false)
    private CurationStatus curationStatus;

    @Column(name = "curator_id", length = 100)
    private String curatorId;

    @Column(name = "reviewer_id", length = 100)
    private String reviewerId;

    @Column(name = "editorial_priority", nullable = false)
    private Integer editorialPriority;

    @Column(name = "review_deadline")
    private OffsetDateTime reviewDeadline;

    @Column(name = "published_at")
    private OffsetDateTime publishedAt;

    @Column(name = "published_by", length = 100)
    private String publishedBy;

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "manual_cluster_ids", columnDefinition = "jsonb")
    private List<String> manualClusterIds = new ArrayList<>();

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "curation_notes", columnDefinition = "jsonb")
    private List<CurationNote> curationNotes = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public boolean isRoot() {
        return parentId == null;
    }

    /**
     * A manual root is the only kind of narrative that may receive assigned children.
     */
    public boolean isManualRoot() {
        return isRoot() && curationSource == CurationSource.MANUAL;
    }

    public void appendNote(CurationNote note) {
        if (curationNotes == null) {
            curationNotes = new ArrayList<>();
        }
        curationNotes.add(note);
    }
}
