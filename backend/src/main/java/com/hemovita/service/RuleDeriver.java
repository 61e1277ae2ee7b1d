package com.hemovita.service;

import com.hemovita.model.enums.EdgeEffect;
import com.hemovita.model.network.BoosterBundle;
import com.hemovita.model.network.GraphEdge;
import com.hemovita.model.network.InteractionRules;
import com.hemovita.model.reference.AliasTable;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Derives scheduling rules from the interaction network edges.
 *
 * - boosts:   source is co-dosed with the target's bundle
 * - inhibits: source and target must not share a slot (registered both ways)
 * - anything else is ignored
 *
 * Both endpoints are collapsed through the alias table first; edges whose
 * endpoints collapse to the same key are dropped.
 */
@Service
public class RuleDeriver {

    private final AliasTable aliasTable;

    public RuleDeriver(AliasTable aliasTable) {
        this.aliasTable = aliasTable;
    }

    public InteractionRules derive(List<GraphEdge> edges) {
        if (edges == null || edges.isEmpty()) {
            return InteractionRules.empty();
        }

        Map<String, LinkedHashSet<String>> boosters = new LinkedHashMap<>();
        Map<String, Set<String>> antagonists = new LinkedHashMap<>();

        for (GraphEdge edge : edges) {
            EdgeEffect effect = edge.effectType();
            if (effect == EdgeEffect.OTHER) {
                continue;
            }

            String sourceKey = aliasTable.keyFor(edge.source());
            String targetKey = aliasTable.keyFor(edge.target());
            if (sourceKey.isEmpty() || targetKey.isEmpty() || sourceKey.equals(targetKey)) {
                continue;
            }

            if (effect == EdgeEffect.BOOSTS) {
                boosters.computeIfAbsent(targetKey, k -> new LinkedHashSet<>()).add(sourceKey);
            } else {
                antagonists.computeIfAbsent(sourceKey, k -> new TreeSet<>()).add(targetKey);
                antagonists.computeIfAbsent(targetKey, k -> new TreeSet<>()).add(sourceKey);
            }
        }

        Map<String, BoosterBundle> bundles = new LinkedHashMap<>();
        boosters.forEach((target, sources) -> bundles.put(target, new BoosterBundle(target, List.copyOf(sources))));
        return new InteractionRules(bundles, antagonists);
    }
}
