package com.hemovita.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Visual grouping of network nodes.
 */
public enum NutrientCluster {
    IRON("iron"),
    B_COMPLEX("b-complex"),
    FAT_SOLUBLE("fat-soluble"),
    OTHER("other");

    private final String value;

    NutrientCluster(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static NutrientCluster of(String nodeId) {
        String k = nodeId.toLowerCase();
        if (k.contains("iron") || k.contains("hemoglobin") || k.contains("ferritin")
                || k.contains("transferrin") || k.contains("tibc")) {
            return IRON;
        }
        if (k.startsWith("vitamin_b")) return B_COMPLEX;
        if (k.equals("vitamin_a") || k.equals("vitamin_d") || k.equals("vitamin_e") || k.equals("vitamin_k")) {
            return FAT_SOLUBLE;
        }
        return OTHER;
    }
}
