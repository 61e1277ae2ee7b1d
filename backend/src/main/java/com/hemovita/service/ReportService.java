package com.hemovita.service;

import com.hemovita.model.enums.LabLabel;
import com.hemovita.model.plan.SupplementPlan;
import com.hemovita.model.reference.FoodSource;
import com.hemovita.model.report.PatientInfo;
import com.hemovita.model.report.Report;
import com.hemovita.model.risk.RiskAssessment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Assembles the full patient report from a lab panel.
 *
 * The demographic risk step is best effort: a failure there is logged and
 * the report is returned without a risk assessment.
 */
@Service
@Slf4j
public class ReportService {

    private final LabClassifierService classifier;
    private final SupplementSchedulerService scheduler;
    private final ExplainerService explainer;
    private final FoodSuggestionService foodSuggestions;
    private final NetworkNotesService networkNotes;
    private final RiskProfileService riskProfiles;
    private final ReportTextFormatter formatter;

    public ReportService(
            LabClassifierService classifier,
            SupplementSchedulerService scheduler,
            ExplainerService explainer,
            FoodSuggestionService foodSuggestions,
            NetworkNotesService networkNotes,
            RiskProfileService riskProfiles,
            ReportTextFormatter formatter) {
        this.classifier = classifier;
        this.scheduler = scheduler;
        this.explainer = explainer;
        this.foodSuggestions = foodSuggestions;
        this.networkNotes = networkNotes;
        this.riskProfiles = riskProfiles;
        this.formatter = formatter;
    }

    public Report generate(Map<String, Double> labs, PatientInfo patient, String dietFilter) {
        Map<String, LabLabel> labels = classifier.classifyPanel(labs);
        SupplementPlan plan = scheduler.schedule(labels);
        Map<String, List<FoodSource>> foods = foodSuggestions.suggest(labels, dietFilter);
        Map<String, List<String>> explanations = explainer.explain(labels);
        List<String> notes = networkNotes.notesFor(plan);
        String text = formatter.format(labs, labels, plan, foods, explanations, patient);

        RiskAssessment assessment = null;
        if (patient == null) {
            return new Report(labels, plan, foods, explanations, notes, text, null);
        }
        try {
            assessment = riskProfiles.assessPatient(
                patient.sex(),
                patient.pregnant(),
                patient.country(),
                patient.population(),
                patient.age() == null ? null : patient.age().doubleValue());
        } catch (RuntimeException e) {
            log.error("Risk model failed, report returned without risk profile", e);
        }

        log.debug("Report built: {} markers, {} flagged for explanation", labels.size(), explanations.size());
        return new Report(labels, plan, foods, explanations, notes, text, assessment);
    }
}
