package com.mirrorgroups.insights.model.insight;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Symmetric pairwise compatibility over the members of a group.
 *
 * <p>{@code scores[i][j]} follows the order of {@code memberIds}; the diagonal is 1.0.
 * {@code pairs} is keyed by {@link #pairKey(String, String)} so lookups do not depend
 * on argument order. Every collection is copied on construction and the score array is
 * copied on the way in and out, so a built matrix cannot lose its symmetry.
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@Value
public class CompatibilityMatrix {

    List<String> memberIds;

    double[][] scores;

    Map<String, PairCompatibility> pairs;

    double averageCompatibility;

    double cohesionScore;

    ScoreDistribution distribution;

    List<HeatmapCell> heatmap;

    List<List<String>> clusters;

    @Builder
    @Jacksonized
    private CompatibilityMatrix(List<String> memberIds, double[][] scores, Map<String, PairCompatibility> pairs,
                                double averageCompatibility, double cohesionScore, ScoreDistribution distribution,
                                List<HeatmapCell> heatmap, List<List<String>> clusters) {
        this.memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
        this.scores = copy(scores);
        this.pairs = pairs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(pairs));
        this.averageCompatibility = averageCompatibility;
        this.cohesionScore = cohesionScore;
        this.distribution = distribution;
        this.heatmap = heatmap == null ? List.of() : List.copyOf(heatmap);
        this.clusters = clusters == null
            ? List.of()
            : clusters.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
    }

    /**
     * @return a copy; changing it does not affect this matrix
     */
    public double[][] getScores() {
        return copy(scores);
    }

    public static String pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }

    public Optional<PairCompatibility> findPair(String a, String b) {
        return Optional.ofNullable(pairs.get(pairKey(a, b)));
    }

    public double scoreBetween(String a, String b) {
        int i = memberIds.indexOf(a);
        int j = memberIds.indexOf(b);
        if (i < 0 || j < 0) {
            throw new IllegalArgumentException("Unknown member in pair " + a + "/" + b);
        }
        return scores[i][j];
    }

    public int pairCount() {
        return pairs.size();
    }

    public double meanPairConfidence() {
        return pairs.values().stream()
            .mapToDouble(PairCompatibility::getConfidence)
            .average()
            .orElse(0.0);
    }

    private static double[][] copy(double[][] source) {
        if (source == null) {
            return new double[0][0];
        }
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }
}
