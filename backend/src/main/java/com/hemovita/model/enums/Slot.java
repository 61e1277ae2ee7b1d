package com.hemovita.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Supplement intake time slots, in schedule order.
 */
public enum Slot {
    MORNING("morning"),
    MIDDAY("midday"),
    EVENING("evening");

    private final String value;

    Slot(String value) {
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

    public static Slot last() {
        Slot[] slots = values();
        return slots[slots.length - 1];
    }
}
