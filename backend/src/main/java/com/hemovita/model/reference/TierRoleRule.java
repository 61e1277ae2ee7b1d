package com.hemovita.model.reference;

import com.hemovita.model.enums.TierRole;

/**
 * Role and selection priority declared for a cutoff type.
 * Lower priority values win when several tiers share a role.
 */
public record TierRoleRule(
    String cutoffType,
    TierRole role,
    int priority
) {

    public static TierRoleRule neutral(String cutoffType) {
        return new TierRoleRule(cutoffType, TierRole.NEUTRAL, Integer.MAX_VALUE);
    }
}
