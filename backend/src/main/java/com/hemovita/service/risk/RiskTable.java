package com.hemovita.service.risk;

import com.hemovita.model.risk.RiskContext;
import com.hemovita.model.risk.RiskObservation;

import java.util.*;

/**
 * Aggregated historical risk per (context, micronutrient).
 *
 * Duplicate rows for the same context and micronutrient are averaged.
 * Contexts and actions are kept in sorted order so that sampling with a
 * fixed seed is reproducible. Also holds the baseline means used when the
 * bandit cannot be applied.
 */
public final class RiskTable {

    private static final Comparator<RiskContext> CONTEXT_ORDER = Comparator
        .comparing(RiskContext::country)
        .thenComparing(RiskContext::population)
        .thenComparing(RiskContext::gender)
        .thenComparingDouble(RiskContext::age);

    private final List<RiskContext> contexts;
    private final List<String> actions;
    private final Map<RiskContext, Map<String, Double>> risks;
    private final Map<String, Map<String, Double>> populationGenderBaseline;
    private final Map<String, Double> globalBaseline;

    private RiskTable(List<RiskObservation> observations) {
        Map<RiskContext, Map<String, Mean>> grouped = new TreeMap<>(CONTEXT_ORDER);
        Map<String, Map<String, Mean>> popGender = new TreeMap<>();
        Map<String, Mean> global = new TreeMap<>();

        for (RiskObservation obs : observations) {
            grouped.computeIfAbsent(obs.context(), k -> new TreeMap<>())
                .computeIfAbsent(obs.micronutrient(), k -> new Mean()).add(obs.trueRisk());
            popGender.computeIfAbsent(populationGenderKey(obs.context().population(), obs.context().gender()),
                    k -> new TreeMap<>())
                .computeIfAbsent(obs.micronutrient(), k -> new Mean()).add(obs.trueRisk());
            global.computeIfAbsent(obs.micronutrient(), k -> new Mean()).add(obs.trueRisk());
        }

        Map<RiskContext, Map<String, Double>> riskMap = new LinkedHashMap<>();
        grouped.forEach((ctx, byAction) -> riskMap.put(ctx, Collections.unmodifiableMap(toValues(byAction))));
        this.risks = Collections.unmodifiableMap(riskMap);
        this.contexts = List.copyOf(riskMap.keySet());

        Map<String, Map<String, Double>> baseline = new LinkedHashMap<>();
        popGender.forEach((key, byAction) -> baseline.put(key, Collections.unmodifiableMap(toValues(byAction))));
        this.populationGenderBaseline = Collections.unmodifiableMap(baseline);
        this.globalBaseline = Collections.unmodifiableMap(toValues(global));
        this.actions = List.copyOf(global.keySet());
    }

    public static RiskTable of(List<RiskObservation> observations) {
        return new RiskTable(observations);
    }

    public List<RiskContext> contexts() {
        return contexts;
    }

    /**
     * All micronutrients seen in the data, sorted.
     */
    public List<String> actions() {
        return actions;
    }

    public List<String> availableActions(RiskContext context) {
        return List.copyOf(risks.getOrDefault(context, Map.of()).keySet());
    }

    public double trueRisk(RiskContext context, String action) {
        Double value = risks.getOrDefault(context, Map.of()).get(action);
        if (value == null) {
            throw new IllegalArgumentException("No risk recorded for " + action + " in " + context);
        }
        return value;
    }

    /**
     * Mean risk per micronutrient for a population and gender; empty when no row matches.
     */
    public Map<String, Double> populationGenderBaseline(String population, String gender) {
        return populationGenderBaseline.getOrDefault(populationGenderKey(population, gender), Map.of());
    }

    public Map<String, Double> globalBaseline() {
        return globalBaseline;
    }

    private static String populationGenderKey(String population, String gender) {
        return population + "\u0000" + gender;
    }

    private static Map<String, Double> toValues(Map<String, Mean> means) {
        Map<String, Double> out = new LinkedHashMap<>();
        means.forEach((k, v) -> out.put(k, v.value()));
        return out;
    }

    private static final class Mean {
        private double sum;
        private int count;

        void add(double value) {
            sum += value;
            count++;
        }

        double value() {
            return count == 0 ? 0.0 : sum / count;
        }
    }
}
