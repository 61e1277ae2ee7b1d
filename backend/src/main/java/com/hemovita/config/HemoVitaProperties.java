package com.hemovita.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine settings bound from the {@code hemovita.*} properties.
 * Table locations are Spring resource strings (classpath: or file:).
 */
@Data
@ConfigurationProperties(prefix = "hemovita")
public class HemoVitaProperties {

    private DataFiles data = new DataFiles();
    private Explainer explainer = new Explainer();
    private Risk risk = new Risk();
    private Foods foods = new Foods();

    @Data
    public static class DataFiles {
        private String cutoffs = "classpath:data/micronutrient_cutoffs_structured.csv";
        private String markers = "classpath:data/markers.json";
        private String tierRoles = "classpath:data/tier_roles.csv";
        private String aliases = "classpath:data/supplement_aliases.csv";
        private String labels = "classpath:data/nutrient_labels.csv";
        private String relationships = "classpath:data/network_relationships.csv";
        private String risk = "classpath:data/micronutrient_data.csv";
        private String foods = "classpath:data/foods_usda.csv";
    }

    @Data
    public static class Explainer {
        private int maxHops = 2;
        private int maxShown = 3;
    }

    @Data
    public static class Risk {
        private int trainingSteps = 30000;
        private long seed = 42L;
        private double alpha = 1.0;
        private double defaultAge = 15.0;
        private double summaryThreshold = 0.15;
        private int summaryTopN = 3;
    }

    @Data
    public static class Foods {
        private int topN = 5;
    }
}
