package com.sni.curation.service;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Descriptive attributes of a narrative at creation time. Hierarchy and workflow fields are not part of it.
 */
@Value
@Builder
public class NarrativeFields {

    String narrativeId;
    String title;
    String summary;
    String confidenceRating;
    String curatorId;
    Integer editorialPriority;
    List<String> manualClusterIds;
}
