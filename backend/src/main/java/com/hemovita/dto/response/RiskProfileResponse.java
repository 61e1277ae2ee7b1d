package com.hemovita.dto.response;

import java.util.List;

/**
 * Response DTO for the raw demographic risk profile.
 */
public record RiskProfileResponse(
    List<RiskEstimateDto> micronutrientRisks,
    String summaryText,
    String disclaimer,
    RiskMetaDto meta
) {}
