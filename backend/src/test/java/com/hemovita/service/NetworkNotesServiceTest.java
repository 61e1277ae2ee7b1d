package com.hemovita.service;

import com.hemovita.model.enums.Slot;
import com.hemovita.model.network.GraphEdge;
import com.hemovita.model.network.InteractionGraph;
import com.hemovita.model.plan.SupplementPlan;
import com.hemovita.model.reference.AliasTable;
import com.hemovita.model.reference.NutrientLabels;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NetworkNotesServiceTest {

    private static final AliasTable ALIASES = new AliasTable(Map.of("Hemoglobin", "iron"));
    private static final NutrientLabels LABELS = new NutrientLabels(Map.of("vitamin_C", "Vitamin C"));

    private static NetworkNotesService service(GraphEdge... edges) {
        return new NetworkNotesService(InteractionGraph.fromEdges(List.of(edges)), ALIASES, LABELS);
    }

    @Nested
    @DisplayName("Notes from edges")
    class FromEdges {

        @Test
        @DisplayName("should explain boosters scheduled in the same slot")
        void boosterNote() {
            SupplementPlan plan = new SupplementPlan();
            plan.add(Slot.MORNING, "iron");
            plan.add(Slot.MORNING, "vitamin_C");

            List<String> notes = service(
                new GraphEdge("vitamin_C", "iron", "boosts", "High", "it improves non-heme absorption."),
                new GraphEdge("vitamin_C", "Hemoglobin", "boosts", "High", "duplicate pair"))
                .notesFor(plan);

            assertThat(notes).containsExactly(
                "Vitamin C and Iron are scheduled together in the morning slot because "
                    + "it improves non-heme absorption (evidence: High).");
        }

        @Test
        @DisplayName("should explain antagonists kept apart")
        void separationNote() {
            SupplementPlan plan = new SupplementPlan();
            plan.add(Slot.MORNING, "iron");
            plan.add(Slot.MIDDAY, "calcium");

            List<String> notes = service(
                new GraphEdge("calcium", "iron", "inhibits", "Moderate", "calcium competes for uptake"))
                .notesFor(plan);

            assertThat(notes).containsExactly(
                "Calcium is kept in the midday slot and Iron in the morning slot to avoid interaction: "
                    + "calcium competes for uptake (evidence: Moderate).");
        }

        @Test
        @DisplayName("should fall back to a default snippet without notes or confidence")
        void defaultSnippet() {
            SupplementPlan plan = new SupplementPlan();
            plan.add(Slot.EVENING, "zinc");
            plan.add(Slot.MORNING, "iron");

            List<String> notes = service(new GraphEdge("iron", "zinc", "inhibits", "", ""))
                .notesFor(plan);

            assertThat(notes).containsExactly(
                "Iron is kept in the morning slot and Zinc in the evening slot to avoid interaction: "
                    + "Zinc can reduce the absorption or effect of Iron when taken together.");
        }

        @Test
        @DisplayName("should give the generic note when no edge applies")
        void genericNote() {
            SupplementPlan plan = new SupplementPlan();
            plan.add(Slot.MORNING, "folate");

            assertThat(service(new GraphEdge("calcium", "iron", "inhibits", "High", "x")).notesFor(plan))
                .containsExactly(NetworkNotesService.GENERIC_NOTE);
        }
    }

    @Test
    @DisplayName("should report a missing network")
    void missingNetwork() {
        NetworkNotesService service = new NetworkNotesService(InteractionGraph.empty(), ALIASES, LABELS);

        assertThat(service.notesFor(new SupplementPlan())).containsExactly(NetworkNotesService.NETWORK_MISSING);
    }

    @Test
    @DisplayName("should join slot names in schedule order")
    void slotPhrase() {
        assertThat(NetworkNotesService.phrase(EnumSet.of(Slot.EVENING))).isEqualTo("evening");
        assertThat(NetworkNotesService.phrase(EnumSet.of(Slot.EVENING, Slot.MORNING))).isEqualTo("morning and evening");
        assertThat(NetworkNotesService.phrase(EnumSet.allOf(Slot.class))).isEqualTo("morning, midday, and evening");
    }
}
