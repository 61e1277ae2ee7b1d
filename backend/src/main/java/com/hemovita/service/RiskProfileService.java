package com.hemovita.service;

import com.hemovita.config.HemoVitaProperties;
import com.hemovita.model.enums.RiskBucket;
import com.hemovita.model.enums.Sex;
import com.hemovita.model.risk.*;
import com.hemovita.service.risk.LinUcbRiskModel;
import com.hemovita.service.risk.RiskTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Demographic micronutrient risk profiles.
 *
 * Countries seen during training are scored by the bandit model. Anything
 * else falls back to the mean risk of the same population and gender across
 * countries, or to the global mean when that group is unknown too.
 */
@Service
@Slf4j
public class RiskProfileService {

    static final String FALLBACK_LEVEL = "population_gender_or_global";
    static final String DEFAULT_GROUP = "All";

    private final LinUcbRiskModel model;
    private final RiskTable table;
    private final HemoVitaProperties.Risk settings;

    public RiskProfileService(LinUcbRiskModel model, RiskTable table, HemoVitaProperties properties) {
        this.model = model;
        this.table = table;
        this.settings = properties.getRisk();
    }

    public RiskProfile profile(String country, String population, String gender, Double age) {
        RiskContext context = RiskContext.of(
            country,
            isBlank(population) ? DEFAULT_GROUP : population,
            isBlank(gender) ? DEFAULT_GROUP : gender,
            age == null ? settings.getDefaultAge() : age);

        boolean countryKnown = model.knowsCountry(context.country());
        List<RiskEstimate> risks;
        String disclaimer = "";

        if (countryKnown) {
            risks = model.predict(context);
        } else {
            log.debug("Country '{}' not in training data, using baseline risks", context.country());
            risks = baseline(context.population(), context.gender());
            disclaimer = "Country-specific data was not available for this profile. Risk estimates are based "
                + "on global patterns for individuals in the same population group ("
                + context.population() + ", " + context.gender() + ").";
        }

        RiskMeta meta = new RiskMeta(
            context.country(),
            context.population(),
            context.gender(),
            context.age(),
            countryKnown,
            !countryKnown,
            countryKnown ? null : FALLBACK_LEVEL);

        return new RiskProfile(risks, summarize(risks), disclaimer, meta);
    }

    /**
     * Risk profile for a patient, with population and gender derived from sex
     * and pregnancy unless a population is given explicitly.
     */
    public RiskAssessment assessPatient(Sex sex, Boolean pregnant, String country, String population, Double age) {
        String defaultPopulation;
        String gender;
        if (sex == Sex.FEMALE) {
            defaultPopulation = Boolean.TRUE.equals(pregnant) ? "Pregnant women" : "Women";
            gender = "Female";
        } else if (sex == Sex.MALE) {
            defaultPopulation = "Men";
            gender = "Male";
        } else {
            defaultPopulation = "Adults";
            gender = DEFAULT_GROUP;
        }

        RiskProfile profile = profile(
            country == null ? "" : country,
            isBlank(population) ? defaultPopulation : population,
            gender,
            age);

        double overall = profile.risks().stream()
            .mapToDouble(RiskEstimate::predictedRisk)
            .max()
            .orElse(0.0);

        List<RiskEstimate> highRisk = profile.risks().stream()
            .filter(r -> r.predictedRisk() >= RiskBucket.HIGH_FLOOR)
            .collect(Collectors.toList());

        String combined = profile.disclaimer().isEmpty()
            ? profile.summaryText()
            : profile.summaryText() + " " + profile.disclaimer();

        return new RiskAssessment(overall, RiskBucket.of(overall), highRisk, profile, combined);
    }

    String summarize(List<RiskEstimate> risks) {
        if (risks.isEmpty()) {
            return "No micronutrient risks could be estimated from demographic profile.";
        }
        List<String> top = risks.stream()
            .filter(r -> r.predictedRisk() >= settings.getSummaryThreshold())
            .limit(settings.getSummaryTopN())
            .map(r -> String.format(Locale.ROOT, "%s (~%.1f%%)", r.micronutrient(), r.predictedRisk() * 100))
            .collect(Collectors.toList());
        if (top.isEmpty()) {
            return "No major micronutrient risks predicted from demographics alone.";
        }
        return "Highest predicted deficiency risks from demographics alone: " + String.join(", ", top) + ".";
    }

    private List<RiskEstimate> baseline(String population, String gender) {
        Map<String, Double> means = table.populationGenderBaseline(population, gender);
        if (means.isEmpty()) {
            means = table.globalBaseline();
        }
        return means.entrySet().stream()
            .map(e -> new RiskEstimate(e.getKey(), clamp(e.getValue())))
            .sorted(Comparator.comparingDouble(RiskEstimate::predictedRisk).reversed())
            .collect(Collectors.toList());
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
