package com.hemovita.model.risk;

import java.util.List;

/**
 * Ranked demographic risk estimates with summary and disclaimer.
 * The disclaimer is empty unless the fallback path was used.
 */
public record RiskProfile(
    List<RiskEstimate> risks,
    String summaryText,
    String disclaimer,
    RiskMeta meta
) {

    public boolean fallbackUsed() {
        return meta.fallbackUsed();
    }
}
