package com.hemovita.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantic role of a cutoff tier.
 * Attached to every tier when the cutoff table is loaded.
 */
public enum TierRole {
    LOW_INDICATOR("low_indicator"),
    HIGH_INDICATOR("high_indicator"),
    NEUTRAL("neutral");

    private final String value;

    TierRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static TierRole fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (TierRole role : values()) {
            if (role.value.equalsIgnoreCase(value.trim())) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown TierRole: " + value);
    }
}
