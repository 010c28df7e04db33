package com.sni.curation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Provenance of a narrative.
 */
public enum CurationSource {

    PIPELINE("pipeline"),
    MANUAL("manual"),
    HYBRID_ASSISTED("hybrid_assisted");

    private final String value;

    CurationSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether a narrative of this provenance may be created in the given status.
     */
    public boolean allowsInitialStatus(CurationStatus status) {
        if (status == null) {
            return false;
        }
        return switch (this) {
            case PIPELINE -> status == CurationStatus.AUTO_GENERATED;
            case MANUAL -> status == CurationStatus.MANUAL_DRAFT;
            case HYBRID_ASSISTED -> status.isEntryState();
        };
    }

    @JsonCreator
    public static CurationSource fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (CurationSource source : values()) {
            if (source.value.equalsIgnoreCase(value) || source.name().equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown curation source: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
