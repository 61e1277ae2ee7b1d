package com.hemovita.service;

import com.hemovita.config.HemoVitaProperties;
import com.hemovita.model.enums.RiskBucket;
import com.hemovita.model.enums.Sex;
import com.hemovita.model.risk.*;
import com.hemovita.service.risk.ContextEncoder;
import com.hemovita.service.risk.LinUcbRiskModel;
import com.hemovita.service.risk.RiskTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RiskProfileServiceTest {

    private RiskProfileService service;

    @BeforeEach
    void setUp() {
        RiskContext pkWomen = RiskContext.of("Pakistan", "Women", "Female", 28);
        RiskContext inWomen = RiskContext.of("India", "Women", "Female", 28);
        RiskContext pkMen = RiskContext.of("Pakistan", "Men", "Male", 35);
        RiskTable table = RiskTable.of(List.of(
            new RiskObservation(pkWomen, "Iron", 0.5),
            new RiskObservation(pkWomen, "Vitamin A", 0.3),
            new RiskObservation(inWomen, "Iron", 0.4),
            new RiskObservation(inWomen, "Vitamin A", 0.1),
            new RiskObservation(pkMen, "Iron", 0.1),
            new RiskObservation(pkMen, "Vitamin A", 0.02)));

        LinUcbRiskModel model = LinUcbRiskModel
            .initial(ContextEncoder.fit(table.contexts()), table.actions(), 1.0)
            .train(table, 2000, 42L);

        service = new RiskProfileService(model, table, new HemoVitaProperties());
    }

    @Nested
    @DisplayName("Raw profile")
    class RawProfile {

        @Test
        @DisplayName("should fall back to the population baseline for an unseen country")
        void unseenCountry() {
            RiskProfile profile = service.profile("Atlantis", "Women", "Female", 30.0);

            assertThat(profile.fallbackUsed()).isTrue();
            assertThat(profile.meta().countryKnown()).isFalse();
            assertThat(profile.meta().fallbackLevel()).isEqualTo("population_gender_or_global");
            assertThat(profile.disclaimer()).isNotBlank().contains("(Women, Female)");
            assertThat(profile.risks()).extracting(RiskEstimate::micronutrient).containsExactly("Iron", "Vitamin A");
            assertThat(profile.risks().get(0).predictedRisk()).isCloseTo(0.45, within(1e-9));
            assertThat(profile.summaryText()).isEqualTo(
                "Highest predicted deficiency risks from demographics alone: Iron (~45.0%), Vitamin A (~20.0%).");
        }

        @Test
        @DisplayName("should use the global baseline when the group is unknown too")
        void globalFallback() {
            RiskProfile profile = service.profile("Atlantis", "Elders", "All", null);

            assertThat(profile.fallbackUsed()).isTrue();
            assertThat(profile.meta().age()).isEqualTo(15.0);
            assertThat(profile.risks().get(0).micronutrient()).isEqualTo("Iron");
            assertThat(profile.risks().get(0).predictedRisk()).isCloseTo(1.0 / 3, within(1e-9));
        }

        @Test
        @DisplayName("should use the bandit for a training country")
        void knownCountry() {
            RiskProfile profile = service.profile("Pakistan", "Women", "Female", 28.0);

            assertThat(profile.fallbackUsed()).isFalse();
            assertThat(profile.meta().countryKnown()).isTrue();
            assertThat(profile.meta().fallbackLevel()).isNull();
            assertThat(profile.disclaimer()).isEmpty();
            assertThat(profile.risks()).hasSize(2)
                .allSatisfy(r -> assertThat(r.predictedRisk()).isBetween(0.0, 1.0));
        }

        @Test
        @DisplayName("should default blank population and gender to All")
        void defaults() {
            RiskProfile profile = service.profile("Atlantis", " ", null, 40.0);

            assertThat(profile.meta().population()).isEqualTo("All");
            assertThat(profile.meta().gender()).isEqualTo("All");
        }
    }

    @Nested
    @DisplayName("Summary text")
    class SummaryText {

        @Test
        @DisplayName("should say so when nothing could be estimated")
        void emptyRisks() {
            assertThat(service.summarize(List.of()))
                .isEqualTo("No micronutrient risks could be estimated from demographic profile.");
        }

        @Test
        @DisplayName("should say so when every risk is below the threshold")
        void allLow() {
            assertThat(service.summarize(List.of(new RiskEstimate("Zinc", 0.05))))
                .isEqualTo("No major micronutrient risks predicted from demographics alone.");
        }

        @Test
        @DisplayName("should list at most three risks")
        void topThree() {
            String summary = service.summarize(List.of(
                new RiskEstimate("Iron", 0.9),
                new RiskEstimate("Zinc", 0.8),
                new RiskEstimate("Iodine", 0.7),
                new RiskEstimate("Folate", 0.6)));

            assertThat(summary).contains("Iron (~90.0%)", "Zinc (~80.0%)", "Iodine (~70.0%)")
                .doesNotContain("Folate");
        }
    }

    @Nested
    @DisplayName("Patient assessment")
    class PatientAssessment {

        @Test
        @DisplayName("should map a pregnant woman to the pregnant women group")
        void pregnantWoman() {
            RiskAssessment assessment = service.assessPatient(Sex.FEMALE, true, "Atlantis", null, 30.0);

            RiskMeta meta = assessment.profile().meta();
            assertThat(meta.population()).isEqualTo("Pregnant women");
            assertThat(meta.gender()).isEqualTo("Female");
            assertThat(assessment.combinedSummary())
                .startsWith(assessment.profile().summaryText())
                .endsWith(assessment.profile().disclaimer());
        }

        @Test
        @DisplayName("should let an explicit population win over the derived one")
        void explicitPopulation() {
            RiskAssessment assessment = service.assessPatient(Sex.MALE, null, "Pakistan", "Women", 30.0);

            assertThat(assessment.profile().meta().population()).isEqualTo("Women");
            assertThat(assessment.profile().meta().gender()).isEqualTo("Male");
        }

        @Test
        @DisplayName("should derive the overall risk, bucket and high-risk list")
        void overallRisk() {
            RiskAssessment assessment = service.assessPatient(Sex.FEMALE, false, "Atlantis", null, 30.0);

            assertThat(assessment.overallRisk()).isCloseTo(0.45, within(1e-9));
            assertThat(assessment.bucket()).isEqualTo(RiskBucket.MODERATE);
            assertThat(assessment.highRisk()).isEmpty();
        }

        @Test
        @DisplayName("should fall back to adults when sex is missing")
        void noSex() {
            RiskAssessment assessment = service.assessPatient(null, null, null, null, null);

            assertThat(assessment.profile().meta().population()).isEqualTo("Adults");
            assertThat(assessment.profile().meta().gender()).isEqualTo("All");
            assertThat(assessment.profile().fallbackUsed()).isTrue();
        }
    }
}
