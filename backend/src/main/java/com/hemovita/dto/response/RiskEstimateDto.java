package com.hemovita.dto.response;

public record RiskEstimateDto(
    String micronutrient,
    double predictedRisk
) {}
