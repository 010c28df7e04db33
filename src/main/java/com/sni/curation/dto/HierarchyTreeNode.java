package com.sni.curation.dto;

import com.sni.curation.model.CurationStatus;
import com.sni.curation.model.Narrative;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One row of a two-level hierarchy tree: the root at level 0, its children at level 1.
 */
public record HierarchyTreeNode(
        int hierarchyLevel,
        UUID id,
        String narrativeId,
        String title,
        String summary,
        UUID parentId,
        OffsetDateTime createdAt,
        String confidenceRating,
        CurationStatus curationStatus,
        boolean parent,
        int childCount
) {
    public static HierarchyTreeNode root(Narrative root, int childCount) {
        return new HierarchyTreeNode(0, root.getId(), root.getNarrativeId(), root.getTitle(), root.getSummary(),
                null, root.getCreatedAt(), root.getConfidenceRating(), root.getCurationStatus(), true, childCount);
    }

    public static HierarchyTreeNode child(Narrative child) {
        return new HierarchyTreeNode(1, child.getId(), child.getNarrativeId(), child.getTitle(), child.getSummary(),
                child.getParentId(), child.getCreatedAt(), child.getConfidenceRating(), child.getCurationStatus(),
                false, 0);
    }
}
