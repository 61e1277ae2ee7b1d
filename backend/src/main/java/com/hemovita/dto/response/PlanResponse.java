package com.hemovita.dto.response;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for a supplement schedule.
 */
public record PlanResponse(
    Map<String, List<String>> supplementPlan,
    List<String> forcedPlacements
) {}
