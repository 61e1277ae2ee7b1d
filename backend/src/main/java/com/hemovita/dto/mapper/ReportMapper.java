package com.hemovita.dto.mapper;

import com.hemovita.dto.request.PatientPayload;
import com.hemovita.dto.response.*;
import com.hemovita.model.plan.SupplementPlan;
import com.hemovita.model.reference.FoodSource;
import com.hemovita.model.report.PatientInfo;
import com.hemovita.model.report.Report;
import com.hemovita.model.risk.RiskAssessment;
import com.hemovita.model.risk.RiskEstimate;
import com.hemovita.model.risk.RiskMeta;
import com.hemovita.model.risk.RiskProfile;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Mapper between request/response DTOs and the engine model.
 */
@Component
public class ReportMapper {

    // ========================================================================
    // Request -> Model
    // ========================================================================

    /**
     * Converts raw JSON lab values to doubles, keeping the caller's order.
     * Numbers are taken as is, numeric strings are parsed, anything else
     * becomes NaN so that the marker classifies as unknown. null stays null.
     */
    public Map<String, Double> toLabValues(Map<String, Object> labs) {
        Map<String, Double> values = new LinkedHashMap<>();
        if (labs == null) {
            return values;
        }
        labs.forEach((marker, raw) -> values.put(marker, toDouble(raw)));
        return values;
    }

    public PatientInfo toPatientInfo(PatientPayload payload) {
        if (payload == null) {
            return null;
        }
        return new PatientInfo(
            payload.age(),
            payload.sex(),
            payload.pregnant(),
            payload.country(),
            payload.notes(),
            payload.population());
    }

    // ========================================================================
    // Model -> DTO
    // ========================================================================

    public ReportResponse toResponse(Report report) {
        RiskAssessment assessment = report.riskAssessment();
        return new ReportResponse(
            report.labels(),
            report.plan().asMap(),
            report.plan().forcedPlacements(),
            toFoodDtos(report.foods()),
            report.networkNotes(),
            report.reportText(),
            toRiskProfileDto(assessment),
            assessment == null ? null : toEstimateDtos(assessment.profile().risks()),
            assessment == null ? null : assessment.combinedSummary());
    }

    public PlanResponse toPlanResponse(SupplementPlan plan) {
        return new PlanResponse(plan.asMap(), plan.forcedPlacements());
    }

    public RiskProfileResponse toRiskProfileResponse(RiskProfile profile) {
        return new RiskProfileResponse(
            toEstimateDtos(profile.risks()),
            profile.summaryText(),
            profile.disclaimer(),
            toMetaDto(profile.meta()));
    }

    public RiskProfileDto toRiskProfileDto(RiskAssessment assessment) {
        if (assessment == null) {
            return null;
        }
        return new RiskProfileDto(
            assessment.overallRisk(),
            assessment.bucket(),
            toEstimateDtos(assessment.highRisk()),
            toEstimateDtos(assessment.profile().risks()),
            assessment.profile().summaryText(),
            toMetaDto(assessment.profile().meta()));
    }

    private Map<String, List<FoodItemDto>> toFoodDtos(Map<String, List<FoodSource>> foods) {
        Map<String, List<FoodItemDto>> out = new LinkedHashMap<>();
        foods.forEach((bundle, items) -> out.put(bundle, items.stream()
            .map(f -> new FoodItemDto(f.food(), f.typicalServeGrams(), f.category()))
            .collect(Collectors.toList())));
        return out;
    }

    private List<RiskEstimateDto> toEstimateDtos(List<RiskEstimate> estimates) {
        return estimates.stream()
            .map(e -> new RiskEstimateDto(e.micronutrient(), e.predictedRisk()))
            .collect(Collectors.toList());
    }

    private RiskMetaDto toMetaDto(RiskMeta meta) {
        return new RiskMetaDto(
            meta.country(),
            meta.population(),
            meta.gender(),
            meta.age(),
            meta.countryKnown(),
            meta.fallbackUsed(),
            meta.fallbackLevel());
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    static Double toDouble(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }
}
