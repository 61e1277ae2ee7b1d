package com.hemovita.service;

import com.hemovita.model.enums.LabLabel;
import com.hemovita.model.enums.Slot;
import com.hemovita.model.network.GraphEdge;
import com.hemovita.model.network.InteractionRules;
import com.hemovita.model.plan.SupplementPlan;
import com.hemovita.model.reference.AliasTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;

class SupplementSchedulerServiceTest {

    private static final AliasTable ALIASES = new AliasTable(Map.of(
        "Hemoglobin", "iron",
        "ferritin", "iron",
        "MCV", "iron"
    ));

    private final RuleDeriver deriver = new RuleDeriver(ALIASES);

    private static GraphEdge edge(String source, String target, String effect) {
        return new GraphEdge(source, target, effect, "High", "");
    }

    private static Map<String, LabLabel> low(String... markers) {
        Map<String, LabLabel> labels = new LinkedHashMap<>();
        for (String marker : markers) {
            labels.put(marker, LabLabel.LOW);
        }
        return labels;
    }

    @Nested
    @DisplayName("Primary placement")
    class PrimaryPlacement {

        @Test
        @DisplayName("should schedule nothing when no marker is low")
        void emptyPlan() {
            SupplementSchedulerService scheduler = new SupplementSchedulerService(ALIASES, InteractionRules.empty());
            Map<String, LabLabel> labels = Map.of("Hemoglobin", LabLabel.NORMAL, "zinc", LabLabel.HIGH);

            SupplementPlan plan = scheduler.schedule(labels);

            assertThat(plan.isEmpty()).isTrue();
            assertThat(plan.asMap()).containsOnlyKeys("morning", "midday", "evening");
        }

        @Test
        @DisplayName("should collapse iron markers into a single key")
        void collapsesMarkers() {
            SupplementSchedulerService scheduler = new SupplementSchedulerService(ALIASES, InteractionRules.empty());

            assertThat(scheduler.deficientKeys(low("Hemoglobin", "ferritin", "MCV", "zinc")))
                .containsExactly("iron", "zinc");
        }

        @Test
        @DisplayName("should move an antagonist to the next free slot")
        void separatesAntagonists() {
            InteractionRules rules = deriver.derive(List.of(edge("calcium", "iron", "inhibits")));
            SupplementSchedulerService scheduler = new SupplementSchedulerService(ALIASES, rules);

            SupplementPlan plan = scheduler.schedule(low("ferritin", "calcium"));

            assertThat(plan.keysIn(Slot.MORNING)).containsExactly("iron");
            assertThat(plan.keysIn(Slot.MIDDAY)).containsExactly("calcium");
            assertThat(plan.forcedPlacements()).isEmpty();
        }

        @Test
        @DisplayName("should force keys into the last slot when every slot conflicts")
        void forcedFallback() {
            List<String> keys = List.of("a", "b", "c", "d");
            List<GraphEdge> edges = new ArrayList<>();
            for (String x : keys) {
                for (String y : keys) {
                    if (!x.equals(y)) {
                        edges.add(edge(x, y, "inhibits"));
                    }
                }
            }
            SupplementSchedulerService scheduler =
                new SupplementSchedulerService(AliasTable.identity(), deriver.derive(edges));

            SupplementPlan plan = scheduler.schedule(low("a", "b", "c", "d"));

            assertThat(plan.keysIn(Slot.MORNING)).containsExactly("a");
            assertThat(plan.keysIn(Slot.MIDDAY)).containsExactly("b");
            assertThat(plan.keysIn(Slot.EVENING)).containsExactly("c", "d");
            assertThat(plan.forcedPlacements()).containsExactly("d");
        }
    }

    @Nested
    @DisplayName("Booster co-location")
    class BoosterColocation {

        @Test
        @DisplayName("should add boosters to the target slot without duplicating keys")
        void noDuplicates() {
            InteractionRules rules = deriver.derive(List.of(
                edge("vitamin_C", "iron", "boosts"),
                edge("vitamin_C", "Hemoglobin", "boosts")));
            SupplementSchedulerService scheduler = new SupplementSchedulerService(ALIASES, rules);

            SupplementPlan plan = scheduler.schedule(low("Hemoglobin", "vitamin_C"));

            assertThat(plan.keysIn(Slot.MORNING)).containsExactly("iron", "vitamin_C");
            assertThat(plan.slotsOf("vitamin_C")).containsExactly(Slot.MORNING);
        }

        @Test
        @DisplayName("should not co-locate a booster that conflicts with the slot")
        void skipsConflictingBooster() {
            InteractionRules rules = deriver.derive(List.of(
                edge("vitamin_C", "iron", "boosts"),
                edge("vitamin_C", "zinc", "inhibits")));
            SupplementSchedulerService scheduler = new SupplementSchedulerService(ALIASES, rules);

            SupplementPlan plan = scheduler.schedule(low("zinc", "ferritin"));

            assertThat(plan.keysIn(Slot.MORNING)).containsExactly("zinc", "iron");
            assertThat(plan.contains(Slot.MORNING, "vitamin_C")).isFalse();
        }

        @Test
        @DisplayName("should never place two antagonists in one slot")
        void antagonistsNeverShareSlot() {
            InteractionRules rules = deriver.derive(List.of(
                edge("vitamin_C", "iron", "boosts"),
                edge("calcium", "iron", "inhibits"),
                edge("zinc", "iron", "inhibits"),
                edge("zinc", "copper", "inhibits"),
                edge("copper", "iron", "boosts")));
            SupplementSchedulerService scheduler = new SupplementSchedulerService(ALIASES, rules);

            SupplementPlan plan = scheduler.schedule(low("ferritin", "calcium", "zinc", "copper"));

            for (Slot slot : Slot.values()) {
                List<String> items = plan.keysIn(slot);
                for (String a : items) {
                    for (String b : items) {
                        assertThat(rules.conflicts(a, b)).as("%s and %s in %s", a, b, slot).isFalse();
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("should schedule iron and vitamin D in the morning for a typical anemic panel")
    void endToEnd() {
        InteractionRules rules = deriver.derive(List.of(
            edge("vitamin_C", "iron", "boosts"),
            edge("calcium", "iron", "inhibits"),
            edge("vitamin_D", "calcium", "boosts"),
            edge("iron", "Hemoglobin", "boosts")));
        SupplementSchedulerService scheduler = new SupplementSchedulerService(ALIASES, rules);

        SupplementPlan plan = scheduler.schedule(low("Hemoglobin", "ferritin", "vitamin_D"));

        assertThat(plan.keysIn(Slot.MORNING)).containsSubsequence("iron", "vitamin_D");
        assertThat(plan.keysIn(Slot.MORNING).stream().filter("iron"::equals)).hasSize(1);
        assertThat(plan.slotsOf("iron")).containsExactly(Slot.MORNING);
    }
}
