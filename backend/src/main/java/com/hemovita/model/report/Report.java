package com.hemovita.model.report;

import com.hemovita.model.enums.LabLabel;
import com.hemovita.model.plan.SupplementPlan;
import com.hemovita.model.reference.FoodSource;
import com.hemovita.model.risk.RiskAssessment;

import java.util.List;
import java.util.Map;

/**
 * Everything produced for one lab panel.
 * riskAssessment is null when the demographic risk step failed.
 */
public record Report(
    Map<String, LabLabel> labels,
    SupplementPlan plan,
    Map<String, List<FoodSource>> foods,
    Map<String, List<String>> explanations,
    List<String> networkNotes,
    String reportText,
    RiskAssessment riskAssessment
) {}
