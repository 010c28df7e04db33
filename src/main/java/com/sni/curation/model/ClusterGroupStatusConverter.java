package com.sni.curation.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link ClusterGroupStatus} under its lower-case name.
 */
@Converter
public class ClusterGroupStatusConverter implements AttributeConverter<ClusterGroupStatus, String> {

    @Override
    public String convertToDatabaseColumn(ClusterGroupStatus attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public ClusterGroupStatus convertToEntityAttribute(String dbData) {
        return dbData != null ? ClusterGroupStatus.fromValue(dbData) : null;
    }
}
