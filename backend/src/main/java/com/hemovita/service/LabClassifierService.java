package com.hemovita.service;

import com.hemovita.model.enums.LabLabel;
import com.hemovita.model.reference.ReferenceRange;
import com.hemovita.model.reference.ReferenceStore;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lab Classifier Service
 *
 * Labels lab values against the resolved reference ranges:
 * - missing or NaN value → unknown
 * - marker without a reference range → unknown
 * - below low → low, above high → high, otherwise normal
 *
 * Bounds themselves count as normal.
 */
@Service
public class LabClassifierService {

    private final ReferenceStore referenceStore;

    public LabClassifierService(ReferenceStore referenceStore) {
        this.referenceStore = referenceStore;
    }

    public LabLabel classify(String marker, Double value) {
        if (value == null || value.isNaN()) {
            return LabLabel.UNKNOWN;
        }

        Optional<ReferenceRange> range = referenceStore.rangeFor(marker);
        if (range.isEmpty()) {
            return LabLabel.UNKNOWN;
        }

        Double low = range.get().low();
        Double high = range.get().high();

        if (low != null && value < low) {
            return LabLabel.LOW;
        }
        if (high != null && value > high) {
            return LabLabel.HIGH;
        }
        return LabLabel.NORMAL;
    }

    /**
     * Classifies each entry independently, keeping the caller's order.
     */
    public Map<String, LabLabel> classifyPanel(Map<String, Double> labs) {
        Map<String, LabLabel> labels = new LinkedHashMap<>();
        if (labs == null) {
            return labels;
        }
        labs.forEach((marker, value) -> labels.put(marker, classify(marker, value)));
        return labels;
    }
}
