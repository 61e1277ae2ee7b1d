package com.hemovita.model.reference;

/**
 * One row of the structured cutoff table.
 */
public record CutoffRow(
    String micronutrient,
    String biomarker,
    String populationGroup,
    String unit,
    String cutoffType,
    double cutoffValue
) {}
