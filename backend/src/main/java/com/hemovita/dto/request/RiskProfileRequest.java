package com.hemovita.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Request DTO for a standalone demographic risk profile.
 */
public record RiskProfileRequest(
    String country,
    String population,
    String gender,
    @Min(0) @Max(120) Double age
) {}
