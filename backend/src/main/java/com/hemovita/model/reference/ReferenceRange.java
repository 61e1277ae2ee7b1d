package com.hemovita.model.reference;

/**
 * Resolved low/high bounds for a marker. Either bound may be null.
 */
public record ReferenceRange(Double low, Double high) {

    public boolean isEmpty() {
        return low == null && high == null;
    }
}
