package com.sni.curation.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * One entry in a narrative's (or cluster group's) ordered note list, stored inside a jsonb array.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CurationNote {

    private String action;
    private String detail;
    private String actor;
    private OffsetDateTime timestamp;
}
