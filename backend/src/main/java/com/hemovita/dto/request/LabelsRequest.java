package com.hemovita.dto.request;

import com.hemovita.model.enums.LabLabel;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * Request DTO carrying already classified markers.
 */
public record LabelsRequest(
    @NotNull Map<String, LabLabel> labels,
    @Max(4) Integer maxHops
) {}
