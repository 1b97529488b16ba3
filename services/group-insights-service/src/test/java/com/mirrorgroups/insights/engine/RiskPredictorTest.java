package com.mirrorgroups.insights.engine;

import com.mirrorgroups.insights.model.insight.ConflictRisk;
import com.mirrorgroups.insights.model.insight.RiskSeverity;
import com.mirrorgroups.insights.model.insight.RiskSummary;
import com.mirrorgroups.insights.model.profile.MemberProfile;
import com.mirrorgroups.insights.support.MemberProfiles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mirrorgroups.insights.support.MemberProfiles.tendency;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit Tests for RiskPredictor
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@DisplayName("Risk Predictor Tests")
class RiskPredictorTest {

    private RiskPredictor predictor;

    @BeforeEach
    void setUp() {
        predictor = new RiskPredictor();
    }

    @Nested
    @DisplayName("Scoring")
    class ScoringTests {

        @Test
        @DisplayName("Should grade severity from the risk score")
        void severity_FromScore() {
            assertThat(RiskSeverity.fromScore(0.1)).isEqualTo(RiskSeverity.LOW);
            assertThat(RiskSeverity.fromScore(0.3)).isEqualTo(RiskSeverity.MEDIUM);
            assertThat(RiskSeverity.fromScore(0.5)).isEqualTo(RiskSeverity.HIGH);
            assertThat(RiskSeverity.fromScore(0.7)).isEqualTo(RiskSeverity.CRITICAL);
        }

        @Test
        @DisplayName("Should never lower severity as the score rises")
        void severity_Monotonic() {
            RiskSeverity previous = RiskSeverity.LOW;
            for (int i = 0; i <= 100; i++) {
                RiskSeverity current = RiskSeverity.fromScore(i / 100.0);
                assertThat(current.compareTo(previous)).isGreaterThanOrEqualTo(0);
                previous = current;
            }
        }

        @Test
        @DisplayName("Should derive risk score and severity at construction")
        void conflictRisk_Derived() {
            ConflictRisk risk = ConflictRisk.builder().type("x").probability(0.9).impact(0.9).build();

            assertThat(risk.getRiskScore()).isCloseTo(0.81, within(1e-9));
            assertThat(risk.getSeverity()).isEqualTo(RiskSeverity.CRITICAL);
            assertThat(risk.getAffectedMembers()).isEmpty();
        }

        @Test
        @DisplayName("Should reward balanced sides in the mismatch probability")
        void mismatchProbability() {
            assertThat(RiskPredictor.mismatchProbability(2, 2, 4)).isCloseTo(0.5, within(1e-9));
            assertThat(RiskPredictor.mismatchProbability(1, 3, 4))
                .isLessThan(RiskPredictor.mismatchProbability(2, 2, 4));
        }

        @Test
        @DisplayName("Should fall back to generic mitigations for unknown types")
        void mitigationsFor_Unknown() {
            assertThat(RiskPredictor.mitigationsFor("unknown")).isEqualTo(RiskPredictor.GENERIC_MITIGATIONS);
            assertThat(RiskPredictor.mitigationsFor(RiskPredictor.EMPATHY_GAP)).hasSize(5);
        }
    }

    @Nested
    @DisplayName("Rules")
    class RuleTests {

        @Test
        @DisplayName("Should flag competing and avoiding styles in the same group")
        void detectResolutionMismatch() {
            // Given
            List<MemberProfile> members = List.of(
                MemberProfiles.withConflictStyle("u1", "competing"),
                MemberProfiles.withConflictStyle("u2", "competing"),
                MemberProfiles.withConflictStyle("u3", "avoiding"),
                MemberProfiles.withConflictStyle("u4", "avoiding"));

            // When
            List<ConflictRisk> risks = predictor.detectResolutionMismatch(members);

            // Then
            assertThat(risks).hasSize(1);
            ConflictRisk risk = risks.get(0);
            assertThat(risk.getType()).isEqualTo(RiskPredictor.RESOLUTION_MISMATCH);
            assertThat(risk.getAffectedMembers()).containsExactly("u1", "u2", "u3", "u4");
            assertThat(risk.getProbability()).isCloseTo(0.5, within(1e-9));
            assertThat(risk.getRiskScore()).isCloseTo(0.4, within(1e-9));
            assertThat(risk.getSeverity()).isEqualTo(RiskSeverity.MEDIUM);
        }

        @Test
        @DisplayName("Should flag an empathy gap only with members on both extremes")
        void detectEmpathyGap() {
            // Given
            List<MemberProfile> members = List.of(
                MemberProfiles.withBehavior("u1", null, 95.0),
                MemberProfiles.withBehavior("u2", null, 85.0),
                MemberProfiles.withBehavior("u3", null, 10.0),
                MemberProfiles.withBehavior("u4", null, 50.0));

            // When
            List<ConflictRisk> risks = predictor.detectEmpathyGap(members);

            // Then
            assertThat(risks).hasSize(1);
            assertThat(risks.get(0).getAffectedMembers()).containsExactly("u1", "u3");
        }

        @Test
        @DisplayName("Should not flag an empathy gap in a uniform group")
        void detectEmpathyGap_Uniform() {
            List<MemberProfile> members = List.of(
                MemberProfiles.withBehavior("u1", null, 60.0),
                MemberProfiles.withBehavior("u2", null, 65.0),
                MemberProfiles.withBehavior("u3", null, 55.0));

            assertThat(predictor.detectEmpathyGap(members)).isEmpty();
        }

        @Test
        @DisplayName("Should flag a group dominated by high social energy")
        void detectEnergyImbalance() {
            List<MemberProfile> members = List.of(
                MemberProfiles.withBehavior("u1", 90.0, null),
                MemberProfiles.withBehavior("u2", 85.0, null),
                MemberProfiles.withBehavior("u3", 80.0, null));

            List<ConflictRisk> risks = predictor.detectEnergyImbalance(members);

            assertThat(risks).extracting(ConflictRisk::getType).containsExactly(RiskPredictor.ENERGY_IMBALANCE);
        }

        @Test
        @DisplayName("Should flag a group dominated by low social energy")
        void detectEnergyImbalance_LowEnergy() {
            List<MemberProfile> members = List.of(
                MemberProfiles.withBehavior("u1", 10.0, null),
                MemberProfiles.withBehavior("u2", 20.0, null),
                MemberProfiles.withBehavior("u3", 25.0, null));

            List<ConflictRisk> risks = predictor.detectEnergyImbalance(members);

            assertThat(risks).hasSize(1);
            assertThat(risks.get(0).getType()).isEqualTo(RiskPredictor.ENERGY_IMBALANCE);
            assertThat(risks.get(0).getDescription()).contains("low-energy introverts (3/3)");
            assertThat(risks.get(0).getAffectedMembers()).containsExactly("u1", "u2", "u3");
        }

        @Test
        @DisplayName("Should not flag a mixed-energy group or one with too few readings")
        void detectEnergyImbalance_Mixed() {
            List<MemberProfile> mixed = List.of(
                MemberProfiles.withBehavior("u1", 10.0, null),
                MemberProfiles.withBehavior("u2", 20.0, null),
                MemberProfiles.withBehavior("u3", 80.0, null));
            List<MemberProfile> sparse = List.of(
                MemberProfiles.withBehavior("u1", 10.0, null),
                MemberProfiles.withBehavior("u2", 20.0, null),
                MemberProfiles.empty("u3"));

            assertThat(predictor.detectEnergyImbalance(mixed)).isEmpty();
            assertThat(predictor.detectEnergyImbalance(sparse)).isEmpty();
        }

        @Test
        @DisplayName("Should flag direct and indirect communicators in the same group")
        void detectCommunicationClash() {
            // Given
            List<MemberProfile> members = List.of(
                MemberProfiles.withCommunicationStyle("u1", "direct"),
                MemberProfiles.withCommunicationStyle("u2", "Direct"),
                MemberProfiles.withCommunicationStyle("u3", "indirect"),
                MemberProfiles.withCommunicationStyle("u4", "indirect"));

            // When
            List<ConflictRisk> risks = predictor.detectCommunicationClash(members);

            // Then
            assertThat(risks).hasSize(1);
            ConflictRisk risk = risks.get(0);
            assertThat(risk.getType()).isEqualTo(RiskPredictor.COMMUNICATION_CLASH);
            assertThat(risk.getAffectedMembers()).containsExactly("u1", "u2", "u3", "u4");
            assertThat(risk.getProbability()).isCloseTo(0.5, within(1e-9));
            assertThat(risk.getImpact()).isEqualTo(RiskPredictor.COMMUNICATION_IMPACT);
        }

        @Test
        @DisplayName("Should not flag communication styles that are not known to clash")
        void detectCommunicationClash_CompatibleStyles() {
            List<MemberProfile> members = List.of(
                MemberProfiles.withCommunicationStyle("u1", "direct"),
                MemberProfiles.withCommunicationStyle("u2", "analytical"),
                MemberProfiles.withCommunicationStyle("u3", "supportive"));

            assertThat(predictor.detectCommunicationClash(members)).isEmpty();
        }

        @Test
        @DisplayName("Should flag high and low commitment members together")
        void detectExpectationDivergence() {
            // Given
            List<MemberProfile> members = List.of(
                MemberProfiles.withValues("u1", List.of(), MemberProfiles.driver("achievement", 0.8)),
                MemberProfiles.withBehavior("u2", 20.0, null),
                MemberProfiles.withValues("u3", List.of(), MemberProfiles.driver("autonomy", 0.9)),
                MemberProfiles.empty("u4"));

            // When
            List<ConflictRisk> risks = predictor.detectExpectationDivergence(members);

            // Then
            assertThat(risks).hasSize(1);
            assertThat(risks.get(0).getType()).isEqualTo(RiskPredictor.EXPECTATION_DIVERGENCE);
            assertThat(risks.get(0).getAffectedMembers()).containsExactly("u1", "u2", "u3");
            assertThat(risks.get(0).getDescription()).contains("1 members expect high engagement while 2");
        }

        @Test
        @DisplayName("Should not flag expectations when nobody prefers minimal commitment")
        void detectExpectationDivergence_OneSided() {
            List<MemberProfile> members = List.of(
                MemberProfiles.withValues("u1", List.of(), MemberProfiles.driver("achievement", 0.8)),
                MemberProfiles.withBehavior("u2", 80.0, null),
                MemberProfiles.withBehavior("u3", 50.0, null));

            assertThat(predictor.detectExpectationDivergence(members)).isEmpty();
        }

        @Test
        @DisplayName("Should flag work style friction when one side clearly outnumbers the other")
        void detectWorkStyleFriction() {
            // Given
            List<MemberProfile> members = List.of(
                MemberProfiles.withCognitive("u1", "systematic", null),
                MemberProfiles.withCognitive("u2", null, "analytical"),
                MemberProfiles.withCognitive("u3", "systematic", null),
                MemberProfiles.withCognitive("u4", "intuitive", null));

            // When
            List<ConflictRisk> risks = predictor.detectWorkStyleFriction(members);

            // Then
            assertThat(risks).hasSize(1);
            assertThat(risks.get(0).getType()).isEqualTo(RiskPredictor.WORK_STYLE_FRICTION);
            assertThat(risks.get(0).getAffectedMembers()).containsExactly("u1", "u2", "u3", "u4");
            assertThat(risks.get(0).getRiskScore()).isCloseTo(0.25, within(1e-9));
        }

        @Test
        @DisplayName("Should not flag work style friction in a balanced group")
        void detectWorkStyleFriction_Balanced() {
            List<MemberProfile> even = List.of(
                MemberProfiles.withCognitive("u1", "systematic", null),
                MemberProfiles.withCognitive("u2", "intuitive", null),
                MemberProfiles.withCognitive("u3", null, "analytical"),
                MemberProfiles.withCognitive("u4", null, "spontaneous"));
            List<MemberProfile> nearlyEven = List.of(
                MemberProfiles.withCognitive("u1", "systematic", null),
                MemberProfiles.withCognitive("u2", "systematic", null),
                MemberProfiles.withCognitive("u3", "systematic", null),
                MemberProfiles.withCognitive("u4", "intuitive", null),
                MemberProfiles.withCognitive("u5", null, "spontaneous"));

            assertThat(predictor.detectWorkStyleFriction(even)).isEmpty();
            assertThat(predictor.detectWorkStyleFriction(nearlyEven)).isEmpty();
        }

        @Test
        @DisplayName("Should flag three or more leadership personalities")
        void detectLeadershipConflict() {
            List<MemberProfile> members = List.of(
                MemberProfiles.withTendencies("u1", tendency("leadership", 0.9)),
                MemberProfiles.withConflictStyle("u2", "competing"),
                MemberProfiles.withValues("u3", List.of(), MemberProfiles.driver("power", 0.8)),
                MemberProfiles.empty("u4"));

            List<ConflictRisk> risks = predictor.detectLeadershipConflict(members);

            assertThat(risks).hasSize(1);
            assertThat(risks.get(0).getAffectedMembers()).containsExactly("u1", "u2", "u3");
            assertThat(risks.get(0).getProbability()).isCloseTo(0.75, within(1e-9));
        }

        @Test
        @DisplayName("Should flag opposing core values")
        void detectValueConflicts() {
            List<MemberProfile> members = List.of(
                MemberProfiles.withValues("u1", List.of("Innovation")),
                MemberProfiles.withValues("u2", List.of("stability")),
                MemberProfiles.withValues("u3", List.of("family")));

            List<ConflictRisk> risks = predictor.detectValueConflicts(members);

            assertThat(risks).hasSize(1);
            assertThat(risks.get(0).getAffectedMembers()).containsExactly("u1", "u2");
            assertThat(risks.get(0).getProbability()).isCloseTo(2.0 / 6.0, within(1e-9));
        }
    }

    @Test
    @DisplayName("Should return risks sorted by score with mitigations attached")
    void predict_SortedWithMitigations() {
        // Given
        List<MemberProfile> members = List.of(
            MemberProfiles.withConflictStyle("u1", "competing"),
            MemberProfiles.withConflictStyle("u2", "avoiding"),
            MemberProfiles.withValues("u3", List.of("speed")),
            MemberProfiles.withValues("u4", List.of("quality")));

        // When
        List<ConflictRisk> risks = predictor.predict(members);

        // Then
        assertThat(risks).isNotEmpty();
        for (int i = 1; i < risks.size(); i++) {
            assertThat(risks.get(i - 1).getRiskScore()).isGreaterThanOrEqualTo(risks.get(i).getRiskScore());
        }
        assertThat(risks).allMatch(r -> !r.getMitigationStrategies().isEmpty());
    }

    @Test
    @DisplayName("Should return nothing for fewer than two members")
    void predict_TooFewMembers() {
        assertThat(predictor.predict(List.of(MemberProfiles.empty("solo")))).isEmpty();
    }

    @Test
    @DisplayName("Should summarize severity counts and overall level")
    void summarize() {
        // Given
        ConflictRisk critical = ConflictRisk.builder().type(RiskPredictor.VALUE_MISALIGNMENT)
            .probability(0.9).impact(0.9).build();
        ConflictRisk low = ConflictRisk.builder().type(RiskPredictor.COMMUNICATION_CLASH)
            .probability(0.2).impact(0.7).build();

        // When
        RiskSummary summary = predictor.summarize(List.of(critical, low));

        // Then
        assertThat(summary.getCriticalCount()).isEqualTo(1);
        assertThat(summary.getLowCount()).isEqualTo(1);
        assertThat(summary.getOverallRiskLevel()).isEqualTo("Critical attention needed");
        assertThat(summary.getTopRisk()).isEqualTo(critical);
        assertThat(summary.getRecommendations()).containsExactly(
            "Address critical risks immediately with group discussion",
            "Create communication guidelines and norms",
            "Facilitate values alignment workshop");
    }

    @Test
    @DisplayName("Should report healthy dynamics without risks")
    void summarize_Empty() {
        RiskSummary summary = predictor.summarize(List.of());

        assertThat(summary.getOverallRiskLevel()).isEqualTo("Low risk - healthy dynamics");
        assertThat(summary.getTopRisk()).isNull();
    }
}
