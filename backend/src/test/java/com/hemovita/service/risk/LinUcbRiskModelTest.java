package com.hemovita.service.risk;

import com.hemovita.model.risk.RiskContext;
import com.hemovita.model.risk.RiskEstimate;
import com.hemovita.model.risk.RiskObservation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LinUcbRiskModelTest {

    private static final RiskContext PK_WOMEN = RiskContext.of("Pakistan", "Women", "Female", 28);
    private static final RiskContext IN_WOMEN = RiskContext.of("India", "Women", "Female", 28);
    private static final RiskContext PK_MEN = RiskContext.of("Pakistan", "Men", "Male", 35);

    private RiskTable table;
    private LinUcbRiskModel initial;

    @BeforeEach
    void setUp() {
        table = RiskTable.of(List.of(
            new RiskObservation(PK_WOMEN, "Iron", 0.6),
            new RiskObservation(PK_WOMEN, "Vitamin A", 0.3),
            new RiskObservation(IN_WOMEN, "Iron", 0.5),
            new RiskObservation(IN_WOMEN, "Zinc", 0.2),
            new RiskObservation(PK_MEN, "Iron", 0.1),
            new RiskObservation(PK_MEN, "Vitamin A", 0.05)));
        initial = LinUcbRiskModel.initial(ContextEncoder.fit(table.contexts()), table.actions(), 1.0);
    }

    @Nested
    @DisplayName("Training")
    class Training {

        @Test
        @DisplayName("should leave the receiver untouched and return a new model")
        void immutable() {
            LinUcbRiskModel trained = initial.train(table, 500, 42L);

            assertThat(trained).isNotSameAs(initial);
            assertThat(trained.trainedSteps()).isEqualTo(500);
            assertThat(initial.trainedSteps()).isZero();
            assertThat(initial.theta("Iron")).containsOnly(new double[] {0.0}, within(1e-12));
        }

        @Test
        @DisplayName("should be reproducible for a fixed seed")
        void deterministic() {
            LinUcbRiskModel first = initial.train(table, 1000, 42L);
            LinUcbRiskModel second = initial.train(table, 1000, 42L);

            for (String action : table.actions()) {
                assertThat(first.theta(action)).containsExactly(second.theta(action));
            }
        }

        @Test
        @DisplayName("should keep the current model when there is nothing to train on")
        void emptyTable() {
            LinUcbRiskModel untrained = initial.train(RiskTable.of(List.of()), 100, 1L);

            assertThat(untrained).isSameAs(initial);
        }
    }

    @Nested
    @DisplayName("Prediction")
    class Prediction {

        @Test
        @DisplayName("should return one clamped estimate per action, highest first")
        void rangeAndOrder() {
            LinUcbRiskModel model = initial.train(table, 2000, 7L);

            for (RiskContext context : List.of(PK_WOMEN, IN_WOMEN, PK_MEN,
                    RiskContext.of("Atlantis", "Elders", "All", 90))) {
                List<RiskEstimate> risks = model.predict(context);

                assertThat(risks).extracting(RiskEstimate::micronutrient)
                    .containsExactlyInAnyOrder("Iron", "Vitamin A", "Zinc");
                assertThat(risks).allSatisfy(r -> assertThat(r.predictedRisk()).isBetween(0.0, 1.0));
                for (int i = 1; i < risks.size(); i++) {
                    assertThat(risks.get(i - 1).predictedRisk()).isGreaterThanOrEqualTo(risks.get(i).predictedRisk());
                }
            }
        }

        @Test
        @DisplayName("should predict zero everywhere before training")
        void untrained() {
            assertThat(initial.predict(PK_WOMEN))
                .allSatisfy(r -> assertThat(r.predictedRisk()).isCloseTo(0.0, within(1e-12)));
        }

        @Test
        @DisplayName("should keep the declared action order when risks are equal")
        void stableOrderOnTies() {
            List<String> declared = List.of("Zinc", "Iron", "Vitamin A");
            LinUcbRiskModel model = LinUcbRiskModel.initial(ContextEncoder.fit(table.contexts()), declared, 1.0);

            assertThat(model.predict(PK_MEN))
                .extracting(RiskEstimate::micronutrient)
                .containsExactlyElementsOf(declared);
        }
    }

    @Test
    @DisplayName("should know only the training countries")
    void countries() {
        assertThat(initial.knowsCountry("Pakistan")).isTrue();
        assertThat(initial.knowsCountry(" India ")).isTrue();
        assertThat(initial.knowsCountry("Atlantis")).isFalse();
        assertThat(initial.knowsCountry(null)).isFalse();
    }

    @Test
    @DisplayName("should reject theta requests for unknown actions")
    void unknownAction() {
        assertThatThrownBy(() -> initial.theta("Iodine"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
