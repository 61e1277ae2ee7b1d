package com.hemovita.model.reference;

import com.hemovita.model.enums.TierRole;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Per-marker cutoff tiers and resolved reference ranges.
 *
 * Built once from the marker catalogue, the cutoff table and the tier role
 * table, then read-only.
 *
 * Bound resolution per marker:
 * 1. The explicit lowTier/highTier of the MarkerSpec, when that tier exists
 * 2. Otherwise the LOW_INDICATOR/HIGH_INDICATOR tier with the smallest
 *    declared priority (ties by tier name)
 */
@Slf4j
public final class ReferenceStore {

    private final Map<String, MarkerSpec> specs;
    private final Map<String, Map<String, Tier>> tiers;
    private final Map<String, ReferenceRange> ranges;

    private ReferenceStore(
            Map<String, MarkerSpec> specs,
            Map<String, Map<String, Tier>> tiers,
            Map<String, ReferenceRange> ranges) {
        this.specs = specs;
        this.tiers = tiers;
        this.ranges = ranges;
    }

    public static ReferenceStore build(
            List<MarkerSpec> markerSpecs,
            List<CutoffRow> cutoffRows,
            Map<String, TierRoleRule> roleRules) {

        Map<String, MarkerSpec> specs = new LinkedHashMap<>();
        Map<String, Map<String, Tier>> tiers = new LinkedHashMap<>();
        Map<String, ReferenceRange> ranges = new LinkedHashMap<>();

        for (MarkerSpec spec : markerSpecs) {
            specs.put(spec.getMarker(), spec);

            Map<String, Tier> markerTiers = new LinkedHashMap<>();
            for (CutoffRow row : cutoffRows) {
                if (!spec.matches(row)) {
                    continue;
                }
                TierRoleRule rule = roleRules.getOrDefault(row.cutoffType(), TierRoleRule.neutral(row.cutoffType()));
                // one tier per name, later rows replace earlier ones
                markerTiers.put(row.cutoffType(),
                    new Tier(row.cutoffType(), row.cutoffValue(), rule.role(), rule.priority()));
            }
            if (markerTiers.isEmpty()) {
                log.warn("No cutoff rows matched marker {}", spec.getMarker());
                continue;
            }
            tiers.put(spec.getMarker(), Collections.unmodifiableMap(markerTiers));

            Double low = resolveBound(markerTiers, spec.getLowTier(), TierRole.LOW_INDICATOR);
            Double high = resolveBound(markerTiers, spec.getHighTier(), TierRole.HIGH_INDICATOR);
            ReferenceRange range = new ReferenceRange(low, high);
            if (!range.isEmpty()) {
                ranges.put(spec.getMarker(), range);
            }
        }

        log.info("Reference store ready: {} markers, {} with reference ranges", specs.size(), ranges.size());
        return new ReferenceStore(
            Collections.unmodifiableMap(specs),
            Collections.unmodifiableMap(tiers),
            Collections.unmodifiableMap(ranges));
    }

    private static Double resolveBound(Map<String, Tier> markerTiers, String explicitTier, TierRole role) {
        if (explicitTier != null && markerTiers.containsKey(explicitTier)) {
            return markerTiers.get(explicitTier).value();
        }
        return markerTiers.values().stream()
            .filter(t -> t.role() == role)
            .min(Comparator.comparingInt(Tier::priority).thenComparing(Tier::name))
            .map(Tier::value)
            .orElse(null);
    }

    public Optional<ReferenceRange> rangeFor(String marker) {
        return Optional.ofNullable(ranges.get(marker));
    }

    public Map<String, Tier> tiersFor(String marker) {
        return tiers.getOrDefault(marker, Map.of());
    }

    public Optional<MarkerSpec> specFor(String marker) {
        return Optional.ofNullable(specs.get(marker));
    }
}
