package com.hemovita.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Effect type of an interaction network edge.
 * Anything that is not "boosts" or "inhibits" is kept as OTHER.
 */
public enum EdgeEffect {
    BOOSTS("boosts"),
    INHIBITS("inhibits"),
    OTHER("other");

    private final String value;

    EdgeEffect(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static EdgeEffect fromValue(String value) {
        if (value == null) {
            return OTHER;
        }
        String normalized = value.trim();
        for (EdgeEffect effect : values()) {
            if (effect.value.equalsIgnoreCase(normalized)) {
                return effect;
            }
        }
        return OTHER;
    }
}
