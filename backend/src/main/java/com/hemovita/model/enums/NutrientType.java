package com.hemovita.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Set;

/**
 * Node type shown in the network graph view.
 */
public enum NutrientType {
    VITAMIN("vitamin"),
    MINERAL("mineral"),
    MARKER("marker"),
    COMPOUND("compound");

    private static final Set<String> MINERALS = Set.of(
        "iron", "zinc", "magnesium", "calcium", "copper", "selenium"
    );

    private static final List<String> MARKER_FRAGMENTS = List.of(
        "hemoglobin", "ferritin", "transferrin", "mcv", "tibc", "indicator_", "homocysteine", "anemia"
    );

    private final String value;

    NutrientType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static NutrientType classify(String nodeId) {
        String k = nodeId.toLowerCase();
        if (k.startsWith("vitamin_")) return VITAMIN;
        if (MINERALS.contains(k)) return MINERAL;
        for (String fragment : MARKER_FRAGMENTS) {
            if (k.contains(fragment)) return MARKER;
        }
        return COMPOUND;
    }
}
