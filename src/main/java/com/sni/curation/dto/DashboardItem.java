package com.sni.curation.dto;

import com.sni.curation.model.CurationSource;
import com.sni.curation.model.CurationStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record DashboardItem(
        UUID id,
        String narrativeId,
        String title,
        CurationStatus curationStatus,
        CurationSource curationSource,
        String curatorId,
        String reviewerId,
        Integer editorialPriority,
        OffsetDateTime reviewDeadline,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime publishedAt,
        int childCount,
        int manualClusterCount,
        boolean parent,
        boolean manual,
        boolean overdue,
        OffsetDateTime lastActivity
) {}
