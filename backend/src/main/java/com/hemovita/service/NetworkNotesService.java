package com.hemovita.service;

import com.hemovita.model.enums.EdgeEffect;
import com.hemovita.model.enums.Slot;
import com.hemovita.model.network.GraphEdge;
import com.hemovita.model.network.InteractionGraph;
import com.hemovita.model.plan.SupplementPlan;
import com.hemovita.model.reference.AliasTable;
import com.hemovita.model.reference.NutrientLabels;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Turns network edges into plain-language notes about a supplement plan.
 *
 * - boosts edges whose endpoints share a slot explain co-dosing
 * - inhibits edges whose endpoints never share a slot explain separation
 *
 * Edge notes and confidence come straight from the relationships table.
 */
@Service
public class NetworkNotesService {

    static final String NETWORK_MISSING =
        "Supplement timing uses an internal nutrient interaction network, but no relationships were loaded.";
    static final String GENERIC_NOTE =
        "Supplement timing groups compatible nutrients and separates antagonistic ones "
            + "based on the nutrient interaction network.";

    private final InteractionGraph graph;
    private final AliasTable aliasTable;
    private final NutrientLabels labels;

    public NetworkNotesService(InteractionGraph graph, AliasTable aliasTable, NutrientLabels labels) {
        this.graph = graph;
        this.aliasTable = aliasTable;
        this.labels = labels;
    }

    public List<String> notesFor(SupplementPlan plan) {
        if (graph.isEmpty()) {
            return List.of(NETWORK_MISSING);
        }

        List<String> notes = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (GraphEdge edge : graph.edges()) {
            if (edge.effectType() == EdgeEffect.BOOSTS) {
                addBoostNote(plan, edge, notes, seen);
            }
        }
        for (GraphEdge edge : graph.edges()) {
            if (edge.effectType() == EdgeEffect.INHIBITS) {
                addSeparationNote(plan, edge, notes, seen);
            }
        }

        if (notes.isEmpty()) {
            notes.add(GENERIC_NOTE);
        }
        return notes;
    }

    private void addBoostNote(SupplementPlan plan, GraphEdge edge, List<String> notes, Set<String> seen) {
        String src = aliasTable.keyFor(edge.source());
        String tgt = aliasTable.keyFor(edge.target());
        if (src.equals(tgt)) {
            return;
        }
        for (Slot slot : Slot.values()) {
            if (!plan.contains(slot, src) || !plan.contains(slot, tgt)) {
                continue;
            }
            if (!seen.add("boost|" + slot + "|" + pairKey(src, tgt))) {
                continue;
            }
            String prettySrc = labels.labelFor(src);
            String prettyTgt = labels.labelFor(tgt);
            String snippet = edge.notes().isEmpty()
                ? prettySrc + " helps the effectiveness of " + prettyTgt
                : stripPeriod(edge.notes());
            notes.add(prettySrc + " and " + prettyTgt + " are scheduled together in the " + slot
                + " slot because " + snippet + evidence(edge) + ".");
        }
    }

    private void addSeparationNote(SupplementPlan plan, GraphEdge edge, List<String> notes, Set<String> seen) {
        String src = aliasTable.keyFor(edge.source());
        String tgt = aliasTable.keyFor(edge.target());
        Set<Slot> srcSlots = plan.slotsOf(src);
        Set<Slot> tgtSlots = plan.slotsOf(tgt);
        if (srcSlots.isEmpty() || tgtSlots.isEmpty() || !Collections.disjoint(srcSlots, tgtSlots)) {
            return;
        }
        if (!seen.add("inhibit|" + pairKey(src, tgt))) {
            return;
        }
        String prettySrc = labels.labelFor(src);
        String prettyTgt = labels.labelFor(tgt);
        String snippet = edge.notes().isEmpty()
            ? prettyTgt + " can reduce the absorption or effect of " + prettySrc + " when taken together"
            : stripPeriod(edge.notes());
        notes.add(prettySrc + " is kept in the " + phrase(srcSlots) + " slot and " + prettyTgt
            + " in the " + phrase(tgtSlots) + " slot to avoid interaction: " + snippet + evidence(edge) + ".");
    }

    private static String pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }

    private static String evidence(GraphEdge edge) {
        return edge.confidence().isEmpty() ? "" : " (evidence: " + edge.confidence() + ")";
    }

    private static String stripPeriod(String text) {
        String trimmed = text.trim();
        return trimmed.endsWith(".") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    /**
     * "morning", "morning and evening", "morning, midday, and evening".
     */
    static String phrase(Set<Slot> slots) {
        List<String> names = slots.stream().map(Slot::getValue).collect(Collectors.toList());
        if (names.size() == 1) {
            return names.get(0);
        }
        if (names.size() == 2) {
            return names.get(0) + " and " + names.get(1);
        }
        return String.join(", ", names.subList(0, names.size() - 1)) + ", and " + names.get(names.size() - 1);
    }
}
