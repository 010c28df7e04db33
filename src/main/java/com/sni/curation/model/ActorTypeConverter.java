package com.sni.curation.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link ActorType} under its lower-case name.
 */
@Converter
public class ActorTypeConverter implements AttributeConverter<ActorType, String> {

    @Override
    public String convertToDatabaseColumn(ActorType attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public ActorType convertToEntityAttribute(String dbData) {
        return dbData != null ? ActorType.fromValue(dbData) : null;
    }
}
