package com.hemovita.dto.request;

import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * Request DTO carrying a raw lab panel.
 */
public record LabPanelRequest(
    @NotNull Map<String, Object> labs
) {}
