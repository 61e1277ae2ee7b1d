package com.hemovita.model.risk;

/**
 * Predicted deficiency probability for one micronutrient.
 */
public record RiskEstimate(
    String micronutrient,
    double predictedRisk
) {}
