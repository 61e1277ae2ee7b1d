package com.hemovita.model.risk;

import com.hemovita.model.enums.RiskBucket;

import java.util.List;

/**
 * Demographic risk folded into a single patient-level view.
 * combinedSummary is the summary text followed by the disclaimer, when there is one.
 */
public record RiskAssessment(
    double overallRisk,
    RiskBucket bucket,
    List<RiskEstimate> highRisk,
    RiskProfile profile,
    String combinedSummary
) {}
