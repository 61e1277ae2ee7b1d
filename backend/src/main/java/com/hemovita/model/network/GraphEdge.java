package com.hemovita.model.network;

import com.hemovita.model.enums.EdgeEffect;

/**
 * Directed edge of the nutrient interaction network.
 * The effect text is kept verbatim from the relationships table.
 */
public record GraphEdge(
    String source,
    String target,
    String effect,
    String confidence,
    String notes
) {

    public EdgeEffect effectType() {
        return EdgeEffect.fromValue(effect);
    }
}
