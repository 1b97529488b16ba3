package com.mirrorgroups.insights.engine;

import com.mirrorgroups.insights.model.insight.CompatibilityFactors;
import com.mirrorgroups.insights.model.insight.CompatibilityMatrix;
import com.mirrorgroups.insights.model.insight.FactorScore;
import com.mirrorgroups.insights.model.insight.PairCompatibility;
import com.mirrorgroups.insights.model.profile.MemberProfile;
import com.mirrorgroups.insights.support.MemberProfiles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit Tests for CompatibilityEngine
 *
 * Tests pair scoring, factor fallbacks, matrix shape and clustering.
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@DisplayName("Compatibility Engine Tests")
class CompatibilityEngineTest {

    private CompatibilityEngine engine;

    @BeforeEach
    void setUp() {
        engine = new CompatibilityEngine();
    }

    private List<MemberProfile> fourMembers() {
        return List.of(
            MemberProfiles.complete("user-d", List.of(0.9, 0.1, 0.4), "direct", "collaborating", 70.0),
            MemberProfiles.complete("user-a", List.of(0.8, 0.2, 0.5), "direct", "compromising", 65.0),
            MemberProfiles.complete("user-c", List.of(-0.3, 0.9, 0.1), "indirect", "avoiding", 10.0),
            MemberProfiles.complete("user-b", List.of(0.1, 0.7, 0.2), "supportive", "accommodating", 40.0));
    }

    @Nested
    @DisplayName("Matrix")
    class MatrixTests {

        @Test
        @DisplayName("Should produce a symmetric matrix with a unit diagonal")
        void calculate_Symmetric() {
            // When
            CompatibilityMatrix matrix = engine.calculate(fourMembers());

            // Then
            double[][] scores = matrix.getScores();
            assertThat(scores).hasNumberOfRows(4);
            for (int i = 0; i < 4; i++) {
                assertThat(scores[i][i]).isEqualTo(1.0);
                for (int j = 0; j < 4; j++) {
                    assertThat(scores[i][j]).isEqualTo(scores[j][i]);
                    assertThat(scores[i][j]).isBetween(0.0, 1.0);
                }
            }
            assertThat(matrix.pairCount()).isEqualTo(6);
            assertThat(matrix.getHeatmap()).hasSize(16);
        }

        @Test
        @DisplayName("Should keep member order from the input")
        void calculate_PreservesOrder() {
            // When
            CompatibilityMatrix matrix = engine.calculate(fourMembers());

            // Then
            assertThat(matrix.getMemberIds()).containsExactly("user-d", "user-a", "user-c", "user-b");
            assertThat(matrix.scoreBetween("user-a", "user-c"))
                .isEqualTo(matrix.findPair("user-c", "user-a").orElseThrow().getScore());
        }

        @Test
        @DisplayName("Should return identical output for identical input")
        void calculate_Deterministic() {
            // When
            CompatibilityMatrix first = engine.calculate(fourMembers());
            CompatibilityMatrix second = engine.calculate(fourMembers());

            // Then
            assertThat(second.getScores()).isDeepEqualTo(first.getScores());
            assertThat(second.getAverageCompatibility()).isEqualTo(first.getAverageCompatibility());
            assertThat(second.getClusters()).isEqualTo(first.getClusters());
        }

        @Test
        @DisplayName("Should stay symmetric when a caller edits the returned scores")
        void calculate_ScoresNotShared() {
            // Given
            CompatibilityMatrix matrix = engine.calculate(fourMembers());
            double original = matrix.scoreBetween("user-d", "user-a");

            // When
            matrix.getScores()[0][1] = 0.0;

            // Then
            assertThat(matrix.scoreBetween("user-d", "user-a")).isEqualTo(original);
            assertThat(matrix.scoreBetween("user-a", "user-d")).isEqualTo(original);
        }

        @Test
        @DisplayName("Should not let callers change pair details or member lists")
        void calculate_CollectionsReadOnly() {
            // Given
            CompatibilityMatrix matrix = engine.calculate(fourMembers());
            PairCompatibility pair = matrix.findPair("user-d", "user-a").orElseThrow();

            // When/Then
            assertThatThrownBy(() -> pair.getStrengths().add("injected"))
                .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> matrix.getMemberIds().add("user-z"))
                .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> matrix.getPairs().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("Should reject fewer than two members")
        void calculate_TooFewMembers() {
            assertThatThrownBy(() -> engine.calculate(List.of(MemberProfiles.empty("solo"))))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should count every all-neutral pair in the neutral bucket")
        void calculate_NeutralDistribution() {
            // Given
            List<MemberProfile> members = List.of(
                MemberProfiles.empty("u1"), MemberProfiles.empty("u2"), MemberProfiles.empty("u3"));

            // When
            CompatibilityMatrix matrix = engine.calculate(members);

            // Then
            assertThat(matrix.getDistribution().getNeutral()).isEqualTo(3);
            assertThat(matrix.getAverageCompatibility()).isCloseTo(0.5, within(1e-9));
            assertThat(matrix.meanPairConfidence()).isZero();
        }
    }

    @Nested
    @DisplayName("Pairs")
    class PairTests {

        @Test
        @DisplayName("Should fall back to neutral factors when a member shared nothing")
        void calculatePair_MissingData() {
            // Given
            MemberProfile full = MemberProfiles.complete("user-1", List.of(0.5, 0.5), "direct", "competing", 50.0);
            MemberProfile bare = MemberProfiles.empty("user-2");

            // When
            PairCompatibility pair = engine.calculatePair(full, bare);

            // Then
            CompatibilityFactors factors = pair.getFactors();
            for (FactorScore factor : List.of(factors.getPersonality(), factors.getCommunication(),
                factors.getConflictStyle(), factors.getEnergyBalance())) {
                assertThat(factor.getScore()).isEqualTo(0.5);
                assertThat(factor.isHasData()).isFalse();
            }
            assertThat(pair.getScore()).isCloseTo(0.5, within(1e-9));
            assertThat(pair.getConfidence()).isZero();
        }

        @Test
        @DisplayName("Should order pair members lexicographically")
        void calculatePair_OrdersMembers() {
            // When
            PairCompatibility pair = engine.calculatePair(MemberProfiles.empty("zed"), MemberProfiles.empty("amy"));

            // Then
            assertThat(pair.getMemberA()).isEqualTo("amy");
            assertThat(pair.getMemberB()).isEqualTo("zed");
        }

        @Test
        @DisplayName("Should weight the four factors into the pair score")
        void calculatePair_WeightedScore() {
            // Given identical embeddings, same style, collaborating vs competing, energy gap 30
            MemberProfile a = MemberProfiles.complete("a", List.of(1.0, 0.0), "direct", "collaborating", 80.0);
            MemberProfile b = MemberProfiles.complete("b", List.of(1.0, 0.0), "direct", "competing", 50.0);

            // When
            PairCompatibility pair = engine.calculatePair(a, b);

            // Then
            double expected = 1.0 * 0.4 + 1.0 * 0.3 + 0.8 * 0.2 + 0.8 * 0.1;
            assertThat(pair.getScore()).isCloseTo(expected, within(1e-9));
            assertThat(pair.getConfidence()).isEqualTo(1.0);
            assertThat(pair.getStrengths()).contains("Both prefer direct communication styles");
        }
    }

    @Nested
    @DisplayName("Factors")
    class FactorTests {

        @Test
        @DisplayName("Should score identical communication styles as 1.0")
        void communicationFactor_SameStyle() {
            FactorScore score = engine.communicationFactor(
                MemberProfiles.withCommunicationStyle("a", "analytical"),
                MemberProfiles.withCommunicationStyle("b", "analytical"));

            assertThat(score.getScore()).isEqualTo(1.0);
            assertThat(score.isHasData()).isTrue();
        }

        @Test
        @DisplayName("Should read the communication table symmetrically")
        void communicationFactor_Symmetric() {
            MemberProfile analytical = MemberProfiles.withCommunicationStyle("a", "analytical");
            MemberProfile indirect = MemberProfiles.withCommunicationStyle("b", "indirect");

            assertThat(engine.communicationFactor(analytical, indirect).getScore()).isEqualTo(0.4);
            assertThat(engine.communicationFactor(indirect, analytical).getScore()).isEqualTo(0.4);
        }

        @Test
        @DisplayName("Should treat an unknown declared style as neutral with data")
        void communicationFactor_UnknownStyle() {
            FactorScore score = engine.communicationFactor(
                MemberProfiles.withCommunicationStyle("a", "telepathic"),
                MemberProfiles.withCommunicationStyle("b", "direct"));

            assertThat(score.getScore()).isEqualTo(0.5);
            assertThat(score.isHasData()).isTrue();
        }

        @Test
        @DisplayName("Should score competing against avoiding as 0.2")
        void conflictFactor_Table() {
            FactorScore score = engine.conflictFactor(
                MemberProfiles.withConflictStyle("a", "competing"),
                MemberProfiles.withConflictStyle("b", "avoiding"));

            assertThat(score.getScore()).isEqualTo(0.2);
        }

        @Test
        @DisplayName("Should step energy balance by the social energy difference")
        void energyFactor_Steps() {
            MemberProfile base = MemberProfiles.withBehavior("a", 50.0, null);

            assertThat(engine.energyFactor(base, MemberProfiles.withBehavior("b", 65.0, null)).getScore()).isEqualTo(1.0);
            assertThat(engine.energyFactor(base, MemberProfiles.withBehavior("b", 80.0, null)).getScore()).isEqualTo(0.8);
            assertThat(engine.energyFactor(base, MemberProfiles.withBehavior("b", 0.0, null)).getScore()).isEqualTo(0.6);
            assertThat(engine.energyFactor(base, MemberProfiles.withBehavior("b", 110.0, null)).getScore()).isEqualTo(0.4);
        }

        @Test
        @DisplayName("Should rescale opposite embeddings to zero")
        void personalityFactor_Opposite() {
            MemberProfile a = MemberProfiles.complete("a", List.of(1.0, 0.0), "direct", "competing", 50.0);
            MemberProfile b = MemberProfiles.complete("b", List.of(-1.0, 0.0), "direct", "competing", 50.0);

            assertThat(engine.personalityFactor(a, b).getScore()).isCloseTo(0.0, within(1e-9));
        }

        @Test
        @DisplayName("Should return zero cosine similarity for a zero vector")
        void cosineSimilarity_ZeroNorm() {
            assertThat(CompatibilityEngine.cosineSimilarity(List.of(0.0, 0.0), List.of(1.0, 1.0))).isZero();
        }
    }

    @Nested
    @DisplayName("Clusters and heatmap")
    class ClusterTests {

        @Test
        @DisplayName("Should group members compatible with every cluster member and drop singletons")
        void clusters_Greedy() {
            // Given
            List<String> ids = List.of("a", "b", "c", "d");
            double[][] scores = {
                {1.0, 0.8, 0.9, 0.2},
                {0.8, 1.0, 0.7, 0.3},
                {0.9, 0.7, 1.0, 0.1},
                {0.2, 0.3, 0.1, 1.0}
            };

            // When
            List<List<String>> clusters = engine.clusters(ids, scores);

            // Then c fails against b, d against everyone
            assertThat(clusters).containsExactly(List.of("a", "b"));
        }

        @Test
        @DisplayName("Should map scores to heatmap colors by band")
        void heatmapColor_Bands() {
            assertThat(CompatibilityEngine.heatmapColor(0.85)).isEqualTo("#00aa00");
            assertThat(CompatibilityEngine.heatmapColor(0.65)).isEqualTo("#44ff44");
            assertThat(CompatibilityEngine.heatmapColor(0.45)).isEqualTo("#ffdd44");
            assertThat(CompatibilityEngine.heatmapColor(0.25)).isEqualTo("#ff9944");
            assertThat(CompatibilityEngine.heatmapColor(0.05)).isEqualTo("#ff4444");
        }
    }
}
