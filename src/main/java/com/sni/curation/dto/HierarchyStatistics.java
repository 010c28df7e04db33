package com.sni.curation.dto;

public record HierarchyStatistics(
        long totalNarratives,
        long parentNarratives,
        long childNarratives,
        double avgChildrenPerParent,
        long maxChildrenPerParent
) {}
