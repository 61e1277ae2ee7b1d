package com.hemovita.model.risk;

/**
 * One normalised row of the historical risk table; trueRisk is in [0, 1].
 */
public record RiskObservation(
    RiskContext context,
    String micronutrient,
    double trueRisk
) {}
