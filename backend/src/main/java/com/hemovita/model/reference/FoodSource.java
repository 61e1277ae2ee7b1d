package com.hemovita.model.reference;

/**
 * One curated food row, a top source for a nutrient bundle.
 */
public record FoodSource(
    String food,
    String category,
    String bundle,
    Double typicalServeGrams,
    String dietTag
) {}
