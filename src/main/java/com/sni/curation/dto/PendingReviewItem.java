package com.sni.curation.dto;

import com.sni.curation.model.CurationStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record PendingReviewItem(
        UUID id,
        String narrativeId,
        String title,
        CurationStatus curationStatus,
        String curatorId,
        String reviewerId,
        Integer editorialPriority,
        OffsetDateTime reviewDeadline,
        int childCount,
        int reviewUrgency,
        Integer daysUntilDeadline,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {}
