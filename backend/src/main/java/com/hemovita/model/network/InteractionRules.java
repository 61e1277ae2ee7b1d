package com.hemovita.model.network;

import java.util.*;

/**
 * Scheduling rules derived from the interaction network.
 *
 * boosters:    target key -> bundle of co-dosed booster keys (insertion ordered)
 * antagonists: key -> keys that must not share a slot (symmetric)
 */
public final class InteractionRules {

    private static final InteractionRules EMPTY = new InteractionRules(Map.of(), Map.of());

    private final Map<String, BoosterBundle> boosters;
    private final Map<String, Set<String>> antagonists;

    public InteractionRules(Map<String, BoosterBundle> boosters, Map<String, Set<String>> antagonists) {
        this.boosters = Collections.unmodifiableMap(new LinkedHashMap<>(boosters));
        Map<String, Set<String>> copy = new TreeMap<>();
        antagonists.forEach((key, avoid) -> copy.put(key, Collections.unmodifiableSet(new TreeSet<>(avoid))));
        this.antagonists = Collections.unmodifiableMap(copy);
    }

    public static InteractionRules empty() {
        return EMPTY;
    }

    public Collection<BoosterBundle> bundles() {
        return boosters.values();
    }

    public Map<String, BoosterBundle> boosters() {
        return boosters;
    }

    public Map<String, Set<String>> antagonists() {
        return antagonists;
    }

    public Set<String> avoidWith(String key) {
        return antagonists.getOrDefault(key, Set.of());
    }

    /**
     * True when either key lists the other as an antagonist.
     */
    public boolean conflicts(String candidate, String existing) {
        return avoidWith(candidate).contains(existing) || avoidWith(existing).contains(candidate);
    }
}
