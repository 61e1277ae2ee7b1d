package com.hemovita.model.reference;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Human readable names for markers and supplement keys.
 */
public final class NutrientLabels {

    private final Map<String, String> labels;

    public NutrientLabels(Map<String, String> labels) {
        this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    /**
     * Label for a key, or the key itself with underscores replaced and each word capitalised.
     */
    public String labelFor(String key) {
        String label = labels.get(key);
        if (label != null) {
            return label;
        }
        StringBuilder sb = new StringBuilder();
        for (String word : key.replace('_', ' ').split(" ")) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    /**
     * Label for a marker in the lab overview, falling back to the raw marker name.
     */
    public String markerLabel(String marker) {
        return labels.getOrDefault(marker, marker);
    }
}
