package com.hemovita.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hemovita.config.HemoVitaProperties;
import com.hemovita.exception.ReferenceDataException;
import com.hemovita.model.enums.TierRole;
import com.hemovita.model.network.GraphEdge;
import com.hemovita.model.reference.CutoffRow;
import com.hemovita.model.reference.FoodSource;
import com.hemovita.model.reference.MarkerSpec;
import com.hemovita.model.reference.TierRoleRule;
import com.hemovita.model.risk.RiskContext;
import com.hemovita.model.risk.RiskObservation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Loads the reference tables the engine is built from.
 *
 * Required tables (cutoffs, marker catalogue, historical risk) fail with
 * {@link ReferenceDataException} when missing or empty. Optional tables
 * (relationships, foods, aliases, labels, tier roles) load as empty with a
 * warning.
 */
@Repository
@Slf4j
public class ReferenceDataRepository {

    static final String RISK_COLUMN = "P_Deficiency_Primary";

    private final CsvTableReader csvReader;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final HemoVitaProperties properties;

    public ReferenceDataRepository(
            CsvTableReader csvReader,
            ResourceLoader resourceLoader,
            ObjectMapper objectMapper,
            HemoVitaProperties properties) {
        this.csvReader = csvReader;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    // ========================================================================
    // Required tables
    // ========================================================================

    public List<CutoffRow> loadCutoffs() {
        String location = properties.getData().getCutoffs();
        List<CutoffRow> rows = new ArrayList<>();
        for (Map<String, String> row : requireRows(location)) {
            String type = row.getOrDefault("cutoff_type", "");
            Double value = parseDouble(row.get("cutoff_value"));
            if (type.isEmpty() || value == null) {
                log.warn("Skipping cutoff row without type or value: {}", row);
                continue;
            }
            rows.add(new CutoffRow(
                row.getOrDefault("micronutrient", ""),
                row.getOrDefault("biomarker", ""),
                row.getOrDefault("population_group", ""),
                row.getOrDefault("unit", ""),
                type,
                value));
        }
        if (rows.isEmpty()) {
            throw new ReferenceDataException("Cutoff table has no usable rows: " + location);
        }
        log.info("Loaded {} cutoff rows from {}", rows.size(), location);
        return rows;
    }

    public List<MarkerSpec> loadMarkerSpecs() {
        String location = properties.getData().getMarkers();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ReferenceDataException("Marker catalogue not found: " + location);
        }
        List<MarkerSpec> specs;
        try (InputStream in = resource.getInputStream()) {
            specs = objectMapper.readValue(in, new TypeReference<List<MarkerSpec>>() {});
        } catch (IOException e) {
            throw new ReferenceDataException("Failed to parse marker catalogue: " + location, e);
        }
        if (specs == null || specs.isEmpty()) {
            throw new ReferenceDataException("Marker catalogue is empty: " + location);
        }
        log.info("Loaded {} marker specs from {}", specs.size(), location);
        return specs;
    }

    /**
     * Loads the historical risk table, normalised for training.
     *
     * - rows without a risk value are dropped
     * - risks are divided by 100 when the largest value exceeds 1
     * - a missing age becomes the configured default age
     */
    public List<RiskObservation> loadRiskObservations() {
        String location = properties.getData().getRisk();
        double defaultAge = properties.getRisk().getDefaultAge();

        List<String[]> kept = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        List<Double> ages = new ArrayList<>();
        for (Map<String, String> row : requireRows(location)) {
            Double risk = parseDouble(row.get(RISK_COLUMN));
            if (risk == null) {
                continue;
            }
            Double age = parseDouble(row.get("Age"));
            kept.add(new String[] {
                row.getOrDefault("Country", ""),
                row.getOrDefault("Population", ""),
                row.getOrDefault("Gender", ""),
                row.getOrDefault("Micronutrient", "")
            });
            values.add(risk);
            ages.add(age == null ? defaultAge : age);
        }
        if (kept.isEmpty()) {
            throw new ReferenceDataException("Risk table has no rows with " + RISK_COLUMN + ": " + location);
        }

        boolean percent = values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0) > 1.0;
        List<RiskObservation> observations = new ArrayList<>(kept.size());
        for (int i = 0; i < kept.size(); i++) {
            String[] cols = kept.get(i);
            double risk = percent ? values.get(i) / 100.0 : values.get(i);
            observations.add(new RiskObservation(
                RiskContext.of(cols[0], cols[1], cols[2], ages.get(i)), cols[3], risk));
        }
        log.info("Loaded {} risk observations from {}", observations.size(), location);
        return observations;
    }

    // ========================================================================
    // Optional tables
    // ========================================================================

    public Map<String, TierRoleRule> loadTierRoles() {
        String location = properties.getData().getTierRoles();
        Map<String, TierRoleRule> rules = new LinkedHashMap<>();
        for (Map<String, String> row : optionalRows(location, "tier roles")) {
            String type = row.getOrDefault("cutoff_type", "");
            if (type.isEmpty()) {
                continue;
            }
            String roleValue = row.getOrDefault("role", "neutral");
            TierRole role;
            try {
                role = TierRole.fromValue(roleValue);
            } catch (IllegalArgumentException e) {
                throw new ReferenceDataException(
                    "Unknown role '" + roleValue + "' for cutoff type " + type + " in " + location, e);
            }
            Double priority = parseDouble(row.get("priority"));
            rules.put(type, new TierRoleRule(
                type,
                role,
                priority == null ? Integer.MAX_VALUE : priority.intValue()));
        }
        return rules;
    }

    public Map<String, String> loadAliases() {
        Map<String, String> aliases = new LinkedHashMap<>();
        for (Map<String, String> row : optionalRows(properties.getData().getAliases(), "supplement aliases")) {
            String alias = row.getOrDefault("alias", "");
            String key = row.getOrDefault("supplement_key", "");
            if (!alias.isEmpty() && !key.isEmpty()) {
                aliases.put(alias, key);
            }
        }
        return aliases;
    }

    public Map<String, String> loadLabels() {
        Map<String, String> labels = new LinkedHashMap<>();
        for (Map<String, String> row : optionalRows(properties.getData().getLabels(), "nutrient labels")) {
            String key = row.getOrDefault("key", "");
            if (!key.isEmpty()) {
                labels.put(key, row.getOrDefault("label", key));
            }
        }
        return labels;
    }

    public List<GraphEdge> loadRelationships() {
        List<GraphEdge> edges = new ArrayList<>();
        for (Map<String, String> row : optionalRows(properties.getData().getRelationships(), "relationships")) {
            String source = row.getOrDefault("source", "");
            String target = row.getOrDefault("target", "");
            if (source.isEmpty() || target.isEmpty()) {
                continue;
            }
            edges.add(new GraphEdge(
                source,
                target,
                row.getOrDefault("effect", ""),
                row.getOrDefault("confidence", ""),
                row.getOrDefault("notes", "")));
        }
        log.info("Loaded {} network relationships", edges.size());
        return edges;
    }

    public List<FoodSource> loadFoods() {
        List<FoodSource> foods = new ArrayList<>();
        for (Map<String, String> row : optionalRows(properties.getData().getFoods(), "foods")) {
            foods.add(new FoodSource(
                row.getOrDefault("Food", ""),
                row.getOrDefault("Category", ""),
                row.getOrDefault("Bundle", ""),
                parseDouble(row.get("Typical_serve_g")),
                row.getOrDefault("Diet_tag", "")));
        }
        return foods;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private List<Map<String, String>> requireRows(String location) {
        List<Map<String, String>> rows = csvReader.read(location);
        if (rows.isEmpty()) {
            throw new ReferenceDataException("Reference table is empty: " + location);
        }
        return rows;
    }

    private List<Map<String, String>> optionalRows(String location, String what) {
        if (location == null || location.isBlank() || !csvReader.exists(location)) {
            log.warn("Optional {} table not found at {}; continuing without it", what, location);
            return List.of();
        }
        return csvReader.read(location);
    }

    static Double parseDouble(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isNaN(value) ? null : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
