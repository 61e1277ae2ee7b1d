package com.hemovita.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a single lab value against its reference range.
 */
public enum LabLabel {
    LOW("low"),
    NORMAL("normal"),
    HIGH("high"),
    UNKNOWN("unknown");

    private final String value;

    LabLabel(String value) {
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

    public static LabLabel fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (LabLabel label : values()) {
            if (label.value.equalsIgnoreCase(value.trim())) {
                return label;
            }
        }
        throw new IllegalArgumentException("Unknown LabLabel: " + value);
    }
}
