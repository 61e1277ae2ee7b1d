package com.hemovita.dto.response;

import com.hemovita.model.enums.NutrientCluster;
import com.hemovita.model.enums.NutrientType;
import com.hemovita.model.enums.RelationType;

import java.util.List;

/**
 * Response DTO for the nutrient network visualisation.
 */
public record NetworkGraphDto(
    List<NodeDto> nodes,
    List<LinkDto> links
) {

    public record NodeDto(
        String id,
        String label,
        NutrientType type,
        NutrientCluster cluster,
        double importance,
        double risk,
        double confidence
    ) {}

    public record LinkDto(
        String source,
        String target,
        RelationType relation,
        double strength,
        String confidenceLabel,
        String notes
    ) {}
}
