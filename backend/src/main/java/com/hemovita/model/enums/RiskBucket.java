package com.hemovita.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse bucket for the overall demographic deficiency risk.
 *   Low:      below 0.33
 *   Moderate: below 0.66
 *   High:     0.66 and above
 */
public enum RiskBucket {
    LOW("low"),
    MODERATE("moderate"),
    HIGH("high");

    public static final double MODERATE_FLOOR = 0.33;
    public static final double HIGH_FLOOR = 0.66;

    private final String value;

    RiskBucket(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static RiskBucket of(double overallRisk) {
        if (overallRisk < MODERATE_FLOOR) return LOW;
        if (overallRisk < HIGH_FLOOR) return MODERATE;
        return HIGH;
    }
}
