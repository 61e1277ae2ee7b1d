package com.hemovita.service;

import com.hemovita.config.HemoVitaProperties;
import com.hemovita.model.enums.LabLabel;
import com.hemovita.model.reference.FoodCatalog;
import com.hemovita.model.reference.FoodSource;
import com.hemovita.model.reference.MarkerSpec;
import com.hemovita.model.reference.ReferenceStore;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Suggests top food sources for flagged markers.
 *
 * Each marker names the food bundle it maps to and the label that triggers
 * it (low for deficiencies, high for homocysteine). Foods keep the curated
 * file order; repeated food names within a bundle are dropped.
 */
@Service
public class FoodSuggestionService {

    private final FoodCatalog catalog;
    private final ReferenceStore referenceStore;
    private final int defaultTopN;

    public FoodSuggestionService(FoodCatalog catalog, ReferenceStore referenceStore, HemoVitaProperties properties) {
        this.catalog = catalog;
        this.referenceStore = referenceStore;
        this.defaultTopN = properties.getFoods().getTopN();
    }

    public Map<String, List<FoodSource>> suggest(Map<String, LabLabel> labels, String dietFilter) {
        return suggest(labels, defaultTopN, dietFilter);
    }

    public Map<String, List<FoodSource>> suggest(Map<String, LabLabel> labels, int topN, String dietFilter) {
        Map<String, List<FoodSource>> out = new LinkedHashMap<>();
        if (catalog.isEmpty() || labels == null) {
            return out;
        }

        for (String bundle : bundlesNeeded(labels)) {
            List<FoodSource> picked = new ArrayList<>();
            Set<String> names = new HashSet<>();
            for (FoodSource food : catalog.foods()) {
                if (picked.size() >= topN) {
                    break;
                }
                if (!bundle.equals(food.bundle()) || !matchesDiet(food, dietFilter)) {
                    continue;
                }
                if (names.add(food.food())) {
                    picked.add(food);
                }
            }
            if (!picked.isEmpty()) {
                out.put(bundle, picked);
            }
        }
        return out;
    }

    private List<String> bundlesNeeded(Map<String, LabLabel> labels) {
        LinkedHashSet<String> bundles = new LinkedHashSet<>();
        labels.forEach((marker, label) -> {
            Optional<MarkerSpec> spec = referenceStore.specFor(marker);
            if (spec.isEmpty() || spec.get().getFoodBundle() == null) {
                return;
            }
            LabLabel trigger = spec.get().getFoodTrigger() == null ? LabLabel.LOW : spec.get().getFoodTrigger();
            if (label == trigger) {
                bundles.add(spec.get().getFoodBundle());
            }
        });
        return new ArrayList<>(bundles);
    }

    private static boolean matchesDiet(FoodSource food, String dietFilter) {
        if (dietFilter == null || dietFilter.isBlank()) {
            return true;
        }
        return food.dietTag() != null
            && food.dietTag().toLowerCase(Locale.ROOT).contains(dietFilter.trim().toLowerCase(Locale.ROOT));
    }
}
