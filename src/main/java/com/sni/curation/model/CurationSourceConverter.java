package com.sni.curation.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link CurationSource} under its lower-case name.
 */
@Converter
public class CurationSourceConverter implements AttributeConverter<CurationSource, String> {

    @Override
    public String convertToDatabaseColumn(CurationSource attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public CurationSource convertToEntityAttribute(String dbData) {
        return dbData != null ? CurationSource.fromValue(dbData) : null;
    }
}
