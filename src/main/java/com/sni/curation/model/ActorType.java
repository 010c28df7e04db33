package com.sni.curation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ActorType {

    USER("user"),
    SYSTEM("system"),
    PIPELINE("pipeline");

    private final String value;

    ActorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ActorType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ActorType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown actor type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
