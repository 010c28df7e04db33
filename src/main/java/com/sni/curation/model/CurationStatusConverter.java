package com.sni.curation.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link CurationStatus} under its lower-case name.
 */
@Converter
public class CurationStatusConverter implements AttributeConverter<CurationStatus, String> {

    @Override
    public String convertToDatabaseColumn(CurationStatus attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public CurationStatus convertToEntityAttribute(String dbData) {
        return dbData != null ? CurationStatus.fromValue(dbData) : null;
    }
}
