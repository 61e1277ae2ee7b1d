package com.hemovita.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Administrative sex of the patient.
 * Drives the population/gender defaults of the risk profile.
 */
public enum Sex {
    MALE("male"),
    FEMALE("female");

    private final String value;

    Sex(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }

    @JsonCreator
    public static Sex fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (Sex sex : values()) {
            if (sex.value.equalsIgnoreCase(value.trim())) {
                return sex;
            }
        }
        throw new IllegalArgumentException("Unknown Sex: " + value);
    }
}
