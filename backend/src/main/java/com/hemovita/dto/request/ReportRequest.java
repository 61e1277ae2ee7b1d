package com.hemovita.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * Request DTO for generating a full report.
 * Lab values may be numbers, numeric strings or null.
 */
public record ReportRequest(
    @NotNull Map<String, Object> labs,
    @NotNull @Valid PatientPayload patient,
    String dietFilter
) {}
