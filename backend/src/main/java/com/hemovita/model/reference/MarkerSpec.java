package com.hemovita.model.reference;

import com.hemovita.model.enums.LabLabel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Describes how a lab marker maps onto rows of the cutoff table.
 * Loaded from markers.json at startup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarkerSpec {

    private String marker;

    private String micronutrient;

    private String biomarker;

    private String populationGroup;

    private String unit;

    // Explicit tier names; when absent the tier role table decides
    private String lowTier;

    private String highTier;

    // Food bundle suggested when the marker carries foodTrigger
    private String foodBundle;

    private LabLabel foodTrigger;

    /**
     * Whether a cutoff row belongs to this marker.
     * Population group and unit only filter when they are set.
     */
    public boolean matches(CutoffRow row) {
        if (micronutrient == null || biomarker == null) {
            return false;
        }
        if (!micronutrient.equals(row.micronutrient()) || !biomarker.equals(row.biomarker())) {
            return false;
        }
        if (populationGroup != null && !populationGroup.equals(row.populationGroup())) {
            return false;
        }
        return unit == null || unit.equals(row.unit());
    }
}
