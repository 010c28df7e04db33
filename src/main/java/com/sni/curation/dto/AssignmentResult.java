package com.sni.curation.dto;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of assigning children to a manual parent. Children that already had a parent are reported as skipped.
 */
public record AssignmentResult(
        UUID parentId,
        int assignedCount,
        List<UUID> assignedIds,
        List<UUID> skippedIds
) {
    public AssignmentResult {
        assignedIds = assignedIds == null ? List.of() : List.copyOf(assignedIds);
        skippedIds = skippedIds == null ? List.of() : List.copyOf(skippedIds);
    }
}
