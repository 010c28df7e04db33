package com.sni.curation.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Snapshot of one child narrative held inside a hierarchy cache entry.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HierarchyChildSummary {

    private UUID id;
    private String narrativeId;
    private String title;
    private String confidenceRating;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public static HierarchyChildSummary of(Narrative child) {
        return new HierarchyChildSummary(
                child.getId(),
                child.getNarrativeId(),
                child.getTitle(),
                child.getConfidenceRating(),
                child.getCreatedAt(),
                child.getUpdatedAt()
        );
    }
}
