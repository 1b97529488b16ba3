package com.mirrorgroups.insights.engine;

import com.mirrorgroups.insights.model.insight.CompatibilityFactors;
import com.mirrorgroups.insights.model.insight.CompatibilityMatrix;
import com.mirrorgroups.insights.model.insight.FactorScore;
import com.mirrorgroups.insights.model.insight.HeatmapCell;
import com.mirrorgroups.insights.model.insight.PairCompatibility;
import com.mirrorgroups.insights.model.insight.ScoreDistribution;
import com.mirrorgroups.insights.model.profile.CommunicationStyle;
import com.mirrorgroups.insights.model.profile.ConflictStyle;
import com.mirrorgroups.insights.model.profile.MemberProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Pairwise compatibility scoring.
 *
 * <p>Each unordered pair is scored on four factors, each of which falls back to a
 * neutral 0.5 when either member lacks the data:
 * <ul>
 *   <li>personality - cosine similarity of the embeddings, rescaled to [0,1]</li>
 *   <li>communication - symmetric style table</li>
 *   <li>conflict style - symmetric Thomas-Kilmann table</li>
 *   <li>energy balance - step function over the social energy difference</li>
 * </ul>
 *
 * <p>Output is a pure function of the member list and its order.
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@Component
@Slf4j
public class CompatibilityEngine {

    public static final double PERSONALITY_WEIGHT = 0.4;
    public static final double COMMUNICATION_WEIGHT = 0.3;
    public static final double CONFLICT_WEIGHT = 0.2;
    public static final double ENERGY_WEIGHT = 0.1;

    public static final double STRENGTH_THRESHOLD = 0.7;
    public static final double CHALLENGE_THRESHOLD = 0.4;
    public static final double LOW_CONFIDENCE = 0.75;
    public static final double CLUSTER_THRESHOLD = 0.75;

    // Indexed by CommunicationStyle ordinal: direct, supportive, analytical, indirect
    private static final double[][] COMMUNICATION_TABLE = {
        {1.0, 0.8, 0.7, 0.5},
        {0.8, 1.0, 0.7, 0.6},
        {0.7, 0.7, 1.0, 0.4},
        {0.5, 0.6, 0.4, 1.0}
    };

    // Indexed by ConflictStyle ordinal: competing, collaborating, compromising, avoiding, accommodating
    private static final double[][] CONFLICT_TABLE = {
        {0.3, 0.8, 0.6, 0.2, 0.7},
        {0.8, 0.9, 0.7, 0.4, 0.6},
        {0.6, 0.7, 0.8, 0.5, 0.7},
        {0.2, 0.4, 0.5, 0.3, 0.5},
        {0.7, 0.6, 0.7, 0.5, 0.4}
    };

    /**
     * Score every pair of members.
     *
     * @param members at least two profiles
     * @return the full matrix with pair details, statistics, heatmap and clusters
     */
    public CompatibilityMatrix calculate(List<MemberProfile> members) {
        if (members == null || members.size() < 2) {
            throw new IllegalArgumentException("Compatibility requires at least 2 members");
        }

        int n = members.size();
        List<String> memberIds = new ArrayList<>(n);
        members.forEach(m -> memberIds.add(m.getUserId()));

        double[][] scores = new double[n][n];
        Map<String, PairCompatibility> pairs = new LinkedHashMap<>();

        for (int i = 0; i < n; i++) {
            scores[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                PairCompatibility pair = calculatePair(members.get(i), members.get(j));
                scores[i][j] = pair.getScore();
                scores[j][i] = pair.getScore();
                pairs.put(CompatibilityMatrix.pairKey(pair.getMemberA(), pair.getMemberB()), pair);
            }
        }

        List<Double> pairScores = new ArrayList<>(pairs.size());
        pairs.values().forEach(p -> pairScores.add(p.getScore()));
        double average = mean(pairScores);

        CompatibilityMatrix matrix = CompatibilityMatrix.builder()
            .memberIds(Collections.unmodifiableList(memberIds))
            .scores(scores)
            .pairs(Collections.unmodifiableMap(pairs))
            .averageCompatibility(average)
            .cohesionScore(cohesion(pairScores, average))
            .distribution(distribution(pairScores))
            .heatmap(heatmap(memberIds, scores))
            .clusters(clusters(memberIds, scores))
            .build();

        log.debug("Computed compatibility for {} members ({} pairs), average={}",
            n, pairs.size(), String.format("%.3f", average));
        return matrix;
    }

    /**
     * Score a single pair. The returned detail is keyed by the lexicographically
     * smaller member ID first.
     */
    public PairCompatibility calculatePair(MemberProfile first, MemberProfile second) {
        MemberProfile a = first;
        MemberProfile b = second;
        if (a.getUserId().compareTo(b.getUserId()) > 0) {
            a = second;
            b = first;
        }

        CompatibilityFactors factors = CompatibilityFactors.builder()
            .personality(personalityFactor(a, b))
            .communication(communicationFactor(a, b))
            .conflictStyle(conflictFactor(a, b))
            .energyBalance(energyFactor(a, b))
            .build();

        double score = Math.min(1.0,
            factors.getPersonality().getScore() * PERSONALITY_WEIGHT
                + factors.getCommunication().getScore() * COMMUNICATION_WEIGHT
                + factors.getConflictStyle().getScore() * CONFLICT_WEIGHT
                + factors.getEnergyBalance().getScore() * ENERGY_WEIGHT);
        double confidence = factors.factorsWithData() / 4.0;

        if (confidence < LOW_CONFIDENCE) {
            log.warn("Low confidence compatibility for pair {}/{}: {} of 4 factors had data",
                a.getUserId(), b.getUserId(), factors.factorsWithData());
        }

        List<String> strengths = new ArrayList<>();
        List<String> challenges = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        describe(a, b, factors, strengths, challenges, recommendations);

        return PairCompatibility.builder()
            .memberA(a.getUserId())
            .memberB(b.getUserId())
            .score(score)
            .confidence(confidence)
            .factors(factors)
            .strengths(strengths)
            .challenges(challenges)
            .recommendations(recommendations)
            .build();
    }

    FactorScore personalityFactor(MemberProfile a, MemberProfile b) {
        Optional<List<Double>> ea = a.embedding();
        Optional<List<Double>> eb = b.embedding();
        if (ea.isEmpty() || eb.isEmpty()) {
            return FactorScore.neutral();
        }
        return FactorScore.of((cosineSimilarity(ea.get(), eb.get()) + 1.0) / 2.0);
    }

    FactorScore communicationFactor(MemberProfile a, MemberProfile b) {
        Optional<String> sa = a.communicationStyle();
        Optional<String> sb = b.communicationStyle();
        if (sa.isEmpty() || sb.isEmpty()) {
            return FactorScore.neutral();
        }
        if (sa.get().equals(sb.get())) {
            return FactorScore.of(1.0);
        }
        Optional<CommunicationStyle> ca = CommunicationStyle.fromValue(sa.get());
        Optional<CommunicationStyle> cb = CommunicationStyle.fromValue(sb.get());
        if (ca.isEmpty() || cb.isEmpty()) {
            // Declared but outside the table
            return FactorScore.of(FactorScore.NEUTRAL);
        }
        return FactorScore.of(COMMUNICATION_TABLE[ca.get().ordinal()][cb.get().ordinal()]);
    }

    FactorScore conflictFactor(MemberProfile a, MemberProfile b) {
        Optional<String> sa = a.conflictStyle();
        Optional<String> sb = b.conflictStyle();
        if (sa.isEmpty() || sb.isEmpty()) {
            return FactorScore.neutral();
        }
        Optional<ConflictStyle> ca = ConflictStyle.fromValue(sa.get());
        Optional<ConflictStyle> cb = ConflictStyle.fromValue(sb.get());
        if (ca.isEmpty() || cb.isEmpty()) {
            return FactorScore.of(FactorScore.NEUTRAL);
        }
        return FactorScore.of(CONFLICT_TABLE[ca.get().ordinal()][cb.get().ordinal()]);
    }

    FactorScore energyFactor(MemberProfile a, MemberProfile b) {
        OptionalDouble ea = a.socialEnergy();
        OptionalDouble eb = b.socialEnergy();
        if (ea.isEmpty() || eb.isEmpty()) {
            return FactorScore.neutral();
        }
        double diff = Math.abs(ea.getAsDouble() - eb.getAsDouble());
        if (diff < 20) {
            return FactorScore.of(1.0);
        }
        if (diff < 40) {
            return FactorScore.of(0.8);
        }
        if (diff < 60) {
            return FactorScore.of(0.6);
        }
        return FactorScore.of(0.4);
    }

    /**
     * Cosine similarity over the common prefix of two vectors; 0 when either has zero norm.
     */
    static double cosineSimilarity(List<Double> a, List<Double> b) {
        int length = Math.min(a.size(), b.size());
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < length; i++) {
            double x = a.get(i) == null ? 0.0 : a.get(i);
            double y = b.get(i) == null ? 0.0 : b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, cosine));
    }

    private void describe(MemberProfile a, MemberProfile b, CompatibilityFactors factors,
                          List<String> strengths, List<String> challenges, List<String> recommendations) {
        FactorScore personality = factors.getPersonality();
        if (personality.getScore() > STRENGTH_THRESHOLD) {
            strengths.add("Strong personality alignment creates natural understanding");
        } else if (personality.getScore() < CHALLENGE_THRESHOLD) {
            challenges.add("Significant personality differences may require extra effort to understand each other");
            recommendations.add("Focus on finding common ground and appreciating diverse perspectives");
        }

        FactorScore communication = factors.getCommunication();
        if (communication.getScore() > STRENGTH_THRESHOLD) {
            Optional<String> sa = a.communicationStyle();
            Optional<String> sb = b.communicationStyle();
            if (sa.isPresent() && sa.equals(sb)) {
                strengths.add("Both prefer " + sa.get() + " communication styles");
            } else {
                strengths.add("Complementary communication styles support clear exchanges");
            }
        } else if (communication.getScore() < CHALLENGE_THRESHOLD) {
            challenges.add("Different communication styles may lead to misunderstandings");
            recommendations.add("Be explicit about communication preferences and check for understanding frequently");
        }

        FactorScore conflict = factors.getConflictStyle();
        if (conflict.getScore() > STRENGTH_THRESHOLD) {
            strengths.add("Compatible conflict resolution styles support healthy disagreements");
        } else if (conflict.getScore() < CHALLENGE_THRESHOLD) {
            challenges.add("Mismatched conflict styles could escalate disagreements");
            recommendations.add("Establish ground rules for handling conflicts before they arise");
        }

        FactorScore energy = factors.getEnergyBalance();
        if (energy.getScore() > STRENGTH_THRESHOLD) {
            strengths.add("Well-balanced social energy levels");
        } else if (energy.getScore() < CHALLENGE_THRESHOLD) {
            challenges.add("Different energy levels may cause friction in social situations");
            recommendations.add("Respect each other's need for social interaction or solitude");
        }
    }

    /**
     * Greedy clustering in member order. A member joins the current cluster only when
     * its score with every member already in it reaches the threshold; singletons are dropped.
     */
    List<List<String>> clusters(List<String> memberIds, double[][] scores) {
        int n = memberIds.size();
        boolean[] assigned = new boolean[n];
        List<List<String>> clusters = new ArrayList<>();

        for (int seed = 0; seed < n; seed++) {
            if (assigned[seed]) {
                continue;
            }
            List<Integer> cluster = new ArrayList<>();
            cluster.add(seed);
            assigned[seed] = true;

            for (int candidate = seed + 1; candidate < n; candidate++) {
                if (assigned[candidate]) {
                    continue;
                }
                boolean compatibleWithAll = true;
                for (int member : cluster) {
                    if (scores[candidate][member] < CLUSTER_THRESHOLD) {
                        compatibleWithAll = false;
                        break;
                    }
                }
                if (compatibleWithAll) {
                    cluster.add(candidate);
                    assigned[candidate] = true;
                }
            }

            if (cluster.size() > 1) {
                List<String> ids = new ArrayList<>(cluster.size());
                cluster.forEach(index -> ids.add(memberIds.get(index)));
                clusters.add(Collections.unmodifiableList(ids));
            }
        }
        return Collections.unmodifiableList(clusters);
    }

    List<HeatmapCell> heatmap(List<String> memberIds, double[][] scores) {
        List<HeatmapCell> cells = new ArrayList<>(memberIds.size() * memberIds.size());
        for (int i = 0; i < memberIds.size(); i++) {
            for (int j = 0; j < memberIds.size(); j++) {
                cells.add(HeatmapCell.builder()
                    .x(memberIds.get(i))
                    .y(memberIds.get(j))
                    .value(scores[i][j])
                    .color(heatmapColor(scores[i][j]))
                    .build());
            }
        }
        return Collections.unmodifiableList(cells);
    }

    static String heatmapColor(double score) {
        if (score >= 0.8) return "#00aa00";
        if (score >= 0.6) return "#44ff44";
        if (score >= 0.4) return "#ffdd44";
        if (score >= 0.2) return "#ff9944";
        return "#ff4444";
    }

    /**
     * Short label for a pair score
     */
    public static String interpret(double score) {
        if (score >= 0.8) return "High compatibility";
        if (score >= 0.6) return "Moderate compatibility";
        if (score >= 0.4) return "Needs attention";
        return "High friction risk";
    }

    private static ScoreDistribution distribution(List<Double> pairScores) {
        int low = 0;
        int medium = 0;
        int high = 0;
        int neutral = 0;
        for (double score : pairScores) {
            if (Math.abs(score - FactorScore.NEUTRAL) < 1e-9) {
                neutral++;
            } else if (score < 0.4) {
                low++;
            } else if (score > 0.7) {
                high++;
            } else {
                medium++;
            }
        }
        return ScoreDistribution.builder().low(low).medium(medium).high(high).neutral(neutral).build();
    }

    private static double cohesion(List<Double> pairScores, double average) {
        if (pairScores.isEmpty()) {
            return 0.0;
        }
        double variance = 0.0;
        for (double score : pairScores) {
            variance += (score - average) * (score - average);
        }
        double stdDev = Math.sqrt(variance / pairScores.size());
        double cohesion = average * (1.0 - Math.min(2 * stdDev, 1.0));
        return Math.max(0.0, Math.min(1.0, cohesion));
    }

    private static double mean(List<Double> values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return values.isEmpty() ? 0.0 : sum / values.size();
    }
}
