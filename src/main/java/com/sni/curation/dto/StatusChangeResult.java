package com.sni.curation.dto;

import com.sni.curation.model.CurationStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record StatusChangeResult(
        UUID narrativeId,
        CurationStatus previousStatus,
        CurationStatus newStatus,
        OffsetDateTime publishedAt,
        Long version
) {
    public boolean changed() {
        return previousStatus != newStatus;
    }
}
