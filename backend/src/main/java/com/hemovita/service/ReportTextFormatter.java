package com.hemovita.service;

import com.hemovita.config.HemoVitaProperties;
import com.hemovita.model.enums.LabLabel;
import com.hemovita.model.enums.Slot;
import com.hemovita.model.network.InteractionGraph;
import com.hemovita.model.plan.SupplementPlan;
import com.hemovita.model.reference.FoodSource;
import com.hemovita.model.reference.NutrientLabels;
import com.hemovita.model.report.PatientInfo;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the plain-text patient report.
 */
@Component
public class ReportTextFormatter {

    private static final String NA = "N/A";

    private final NutrientLabels labels;
    private final InteractionGraph graph;
    private final int maxShown;

    public ReportTextFormatter(NutrientLabels labels, InteractionGraph graph, HemoVitaProperties properties) {
        this.labels = labels;
        this.graph = graph;
        this.maxShown = properties.getExplainer().getMaxShown();
    }

    public String format(
            Map<String, Double> labs,
            Map<String, LabLabel> labLabels,
            SupplementPlan plan,
            Map<String, List<FoodSource>> foods,
            Map<String, List<String>> explanations,
            PatientInfo patient) {

        List<String> parts = new ArrayList<>();
        parts.add(header(patient));
        parts.add("");
        section(parts, "1. Lab overview", labBlock(labs, labLabels));
        section(parts, "2. Supplement plan (prototype)", supplementBlock(plan));
        section(parts, "3. Food suggestions (per 100 g, highest nutrient density first)", foodBlock(foods));
        section(parts, "4. Notes on cutoffs",
            "All low/normal/high classifications are derived from a unified cutoff table\n"
                + "(`micronutrient_cutoffs_structured.csv`) built from WHO guidelines, IZiNCG\n"
                + "zinc thresholds, and widely used clinical consensus cutoffs. This table can\n"
                + "be updated independently of the code to reflect new evidence.");
        parts.add("5. Network-based nutrient interactions");
        parts.add(underline("5. Network-based nutrient interactions"));
        parts.add(networkBlock(explanations));
        return String.join("\n", parts);
    }

    private static void section(List<String> parts, String title, String body) {
        parts.add(title);
        parts.add(underline(title));
        parts.add(body);
        parts.add("");
    }

    private static String underline(String title) {
        return "-".repeat(title.length());
    }

    private String header(PatientInfo patient) {
        List<String> lines = new ArrayList<>();
        lines.add("HemoVita - Personalized Micronutrient Report");
        lines.add("============================================");
        lines.add("");
        lines.add("Patient summary:");
        lines.add("- Age: " + orNa(patient == null ? null : patient.age()));
        lines.add("- Sex: " + orNa(patient == null ? null : patient.sex()));
        lines.add("- Pregnant: " + orNa(patient == null ? null : patient.pregnant()));
        lines.add("- Country: " + orNa(patient == null || isBlank(patient.country()) ? null : patient.country()));
        if (patient != null && !isBlank(patient.notes())) {
            lines.add("- Notes: " + patient.notes());
        }
        return String.join("\n", lines);
    }

    private String labBlock(Map<String, Double> labs, Map<String, LabLabel> labLabels) {
        if (labs == null || labs.isEmpty()) {
            return "No labs provided.";
        }
        return labs.entrySet().stream()
            .map(e -> "- " + labels.markerLabel(e.getKey()) + ": "
                + (e.getValue() == null ? NA : e.getValue().toString()) + " -> "
                + labLabels.getOrDefault(e.getKey(), LabLabel.UNKNOWN))
            .collect(Collectors.joining("\n"));
    }

    private String supplementBlock(SupplementPlan plan) {
        List<String> lines = new ArrayList<>();
        for (Slot slot : Slot.values()) {
            List<String> keys = plan.keysIn(slot);
            if (keys.isEmpty()) {
                continue;
            }
            String name = slot.getValue();
            lines.add("- " + Character.toUpperCase(name.charAt(0)) + name.substring(1) + ": "
                + keys.stream().map(labels::markerLabel).collect(Collectors.joining(", ")));
        }
        if (lines.isEmpty()) {
            return "No supplements recommended based on current labs.";
        }
        return String.join("\n", lines);
    }

    private String foodBlock(Map<String, List<FoodSource>> foods) {
        if (foods == null || foods.isEmpty()) {
            return "No specific food suggestions (no matching entries for the flagged deficiencies).";
        }
        List<String> chunks = new ArrayList<>();
        foods.forEach((bundle, items) -> {
            if (items.isEmpty()) {
                return;
            }
            List<String> lines = new ArrayList<>();
            lines.add(labels.markerLabel(bundle) + " - suggested food sources:");
            for (FoodSource food : items) {
                String category = isBlank(food.category()) ? "" : " [" + food.category() + "]";
                String amount = food.typicalServeGrams() == null || food.typicalServeGrams().isNaN()
                    ? ""
                    : " - typical serving ~" + grams(food.typicalServeGrams()) + " g";
                lines.add("  • " + food.food() + category + amount);
            }
            chunks.add(String.join("\n", lines));
        });
        return String.join("\n\n", chunks);
    }

    private String networkBlock(Map<String, List<String>> explanations) {
        if (graph.isEmpty()) {
            return "Nutrient interaction network not available (no relationships were loaded).";
        }
        if (explanations == null || explanations.isEmpty()) {
            return "No network-based causal chains found for the flagged deficiencies.";
        }
        List<String> lines = new ArrayList<>();
        explanations.forEach((target, chains) -> {
            lines.add(labels.markerLabel(target) + ":");
            chains.stream().limit(maxShown).forEach(chain -> lines.add("  • " + chain));
        });
        return String.join("\n", lines);
    }

    static String grams(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String orNa(Object value) {
        return value == null ? NA : value.toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
