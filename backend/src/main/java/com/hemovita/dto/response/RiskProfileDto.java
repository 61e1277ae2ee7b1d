package com.hemovita.dto.response;

import com.hemovita.model.enums.RiskBucket;

import java.util.List;

/**
 * Patient-level risk section of a report.
 */
public record RiskProfileDto(
    double overallRisk,
    RiskBucket riskBucket,
    List<RiskEstimateDto> highRiskMicronutrients,
    List<RiskEstimateDto> micronutrientRisks,
    String summaryText,
    RiskMetaDto meta
) {}
