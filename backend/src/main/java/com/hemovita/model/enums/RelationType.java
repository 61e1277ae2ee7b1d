package com.hemovita.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Relation category shown in the network graph view.
 */
public enum RelationType {
    BOOSTER("booster"),
    ANTAGONIST("antagonist"),
    COFACTOR("cofactor"),
    SHARED("shared");

    private final String value;

    RelationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Maps a raw effect string from the relationships table to a relation.
     */
    public static RelationType fromEffect(String effect) {
        String e = effect == null ? "" : effect.trim().toLowerCase();
        return switch (e) {
            case "boosts", "enhances" -> BOOSTER;
            case "inhibits", "reduces", "blocks" -> ANTAGONIST;
            case "cofactor", "supports" -> COFACTOR;
            default -> SHARED;
        };
    }
}
