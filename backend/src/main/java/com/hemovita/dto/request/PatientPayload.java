package com.hemovita.dto.request;

import com.hemovita.model.enums.Sex;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Patient section of a report request.
 * population, when set, overrides the group derived from sex and pregnancy.
 */
public record PatientPayload(
    @NotNull @Min(0) @Max(120) Integer age,
    @NotNull Sex sex,
    String country,
    String notes,
    Boolean pregnant,
    String population
) {}
