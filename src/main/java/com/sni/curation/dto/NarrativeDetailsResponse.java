package com.sni.curation.dto;

import com.sni.curation.model.CurationLogEntry;
import com.sni.curation.model.Narrative;
import com.sni.curation.model.NarrativeHierarchyCacheEntry;

import java.util.List;

/**
 * Full editorial view of one narrative: the record, its hierarchy neighbourhood and its recent audit trail.
 */
public record NarrativeDetailsResponse(
        Narrative narrative,
        Narrative parent,
        List<Narrative> children,
        NarrativeHierarchyCacheEntry hierarchy,
        List<CurationLogEntry> recentActivity
) {}
