package com.hemovita.model.reference;

import com.hemovita.model.enums.TierRole;

/**
 * A named cutoff for one marker, tagged with its role.
 */
public record Tier(
    String name,
    double value,
    TierRole role,
    int priority
) {}
