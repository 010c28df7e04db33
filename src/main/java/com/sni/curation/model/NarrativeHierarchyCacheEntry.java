package com.sni.curation.model;

import com.google.common.collect.ImmutableList;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Derived per-root aggregate of its children. Never the source of truth; always recomputable from
 * the {@code narratives} table.
 */
@Entity
@Table(name = "narrative_hierarchy_cache")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NarrativeHierarchyCacheEntry {

    @Id
    @Column(name = "parent_id", updatable = false, nullable = false)
    private UUID parentId;

    @Column(name = "parent_narrative_id")
    private String parentNarrativeId;

    @Column(name = "parent_title", columnDefinition = "TEXT")
    private String parentTitle;

    @Column(name = "parent_confidence_rating")
    private String parentConfidenceRating;

    @Column(name = "child_count", nullable = false)
    private int childCount;

    // Ordered by child creation time.
    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "children", columnDefinition = "jsonb")
    private List<HierarchyChildSummary> children = new ArrayList<>();

    @Column(name = "first_child_created_at")
    private OffsetDateTime firstChildCreatedAt;

    @Column(name = "latest_child_created_at")
    private OffsetDateTime latestChildCreatedAt;

    @Column(name = "latest_child_updated_at")
    private OffsetDateTime latestChildUpdatedAt;

    @Column(name = "confidence_diversity", nullable = false)
    private int confidenceDiversity;

    @Column(name = "predominant_child_confidence")
    private String predominantChildConfidence;

    @Column(name = "cache_updated_at", nullable = false)
    private OffsetDateTime cacheUpdatedAt;

    public List<UUID> getChildIds() {
        if (children == null) {
            return ImmutableList.of();
        }
        return children.stream().map(HierarchyChildSummary::getId).collect(ImmutableList.toImmutableList());
    }

    public List<String> getChildTitles() {
        if (children == null) {
            return ImmutableList.of();
        }
        return children.stream()
                .map(HierarchyChildSummary::getTitle)
                .filter(Objects::nonNull)
                .collect(ImmutableList.toImmutableList());
    }

    /**
     * Compares everything except {@code cacheUpdatedAt}.
     */
    public boolean hasSameAggregateAs(NarrativeHierarchyCacheEntry other) {
        if (other == null) {
            return false;
        }
        return Objects.equals(parentId, other.parentId)
                && Objects.equals(parentNarrativeId, other.parentNarrativeId)
                && Objects.equals(parentTitle, other.parentTitle)
                && Objects.equals(parentConfidenceRating, other.parentConfidenceRating)
                && childCount == other.childCount
                && confidenceDiversity == other.confidenceDiversity
                && Objects.equals(predominantChildConfidence, other.predominantChildConfidence)
                && sameInstant(firstChildCreatedAt, other.firstChildCreatedAt)
                && sameInstant(latestChildCreatedAt, other.latestChildCreatedAt)
                && sameInstant(latestChildUpdatedAt, other.latestChildUpdatedAt)
                && sameChildren(children, other.children);
    }

    private static boolean sameChildren(List<HierarchyChildSummary> a, List<HierarchyChildSummary> b) {
        List<HierarchyChildSummary> left = a != null ? a : List.of();
        List<HierarchyChildSummary> right = b != null ? b : List.of();
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            HierarchyChildSummary l = left.get(i);
            HierarchyChildSummary r = right.get(i);
            if (!Objects.equals(l.getId(), r.getId())
                    || !Objects.equals(l.getNarrativeId(), r.getNarrativeId())
                    || !Objects.equals(l.getTitle(), r.getTitle())
                    || !Objects.equals(l.getConfidenceRating(), r.getConfidenceRating())
                    || !sameInstant(l.getCreatedAt(), r.getCreatedAt())
                    || !sameInstant(l.getUpdatedAt(), r.getUpdatedAt())) {
                return false;
            }
        }
        return true;
    }

    private static boolean sameInstant(OffsetDateTime a, OffsetDateTime b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.isEqual(b);
    }
}
