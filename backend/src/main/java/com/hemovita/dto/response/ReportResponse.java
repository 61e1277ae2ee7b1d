package com.hemovita.dto.response;

import com.hemovita.model.enums.LabLabel;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for a full report. The risk fields are null when the
 * demographic risk step could not run.
 */
public record ReportResponse(
    Map<String, LabLabel> labels,
    Map<String, List<String>> supplementPlan,
    List<String> forcedPlacements,
    Map<String, List<FoodItemDto>> foods,
    List<String> networkNotes,
    String reportText,
    RiskProfileDto riskProfile,
    List<RiskEstimateDto> micronutrientRisks,
    String riskSummaryText
) {}
