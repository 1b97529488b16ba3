package com.mirrorgroups.insights.engine;

import com.mirrorgroups.insights.model.insight.ConflictRisk;
import com.mirrorgroups.insights.model.insight.RiskSeverity;
import com.mirrorgroups.insights.model.insight.RiskSummary;
import com.mirrorgroups.insights.model.profile.MemberProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Predicts friction areas within a group.
 *
 * <p>Eight independent rules each may emit risks with a probability and an impact.
 * Severity is never chosen by a rule; it is derived from probability x impact by
 * {@link ConflictRisk}. Every emitted risk receives the mitigation strategies
 * registered for its type.
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@Component
@Slf4j
public class RiskPredictor {

    public static final String RESOLUTION_MISMATCH = "resolution_mismatch";
    public static final String EMPATHY_GAP = "empathy_gap";
    public static final String ENERGY_IMBALANCE = "energy_imbalance";
    public static final String COMMUNICATION_CLASH = "communication_clash";
    public static final String VALUE_MISALIGNMENT = "value_misalignment";
    public static final String EXPECTATION_DIVERGENCE = "expectation_divergence";
    public static final String LEADERSHIP_CONFLICT = "leadership_conflict";
    public static final String WORK_STYLE_FRICTION = "work_style_friction";

    static final double RESOLUTION_IMPACT = 0.8;
    static final double EMPATHY_IMPACT = 0.7;
    static final double ENERGY_IMPACT = 0.6;
    static final double COMMUNICATION_IMPACT = 0.7;
    static final double VALUE_IMPACT = 0.9;
    static final double EXPECTATION_IMPACT = 0.6;
    static final double LEADERSHIP_IMPACT = 0.8;
    static final double WORK_STYLE_IMPACT = 0.5;

    static final double EMPATHY_STDDEV_THRESHOLD = 20.0;
    static final int LEADERSHIP_THRESHOLD = 3;

    // Unordered style pairs; each clash is reported once
    private static final List<List<String>> STYLE_CONFLICTS = List.of(
        List.of("competing", "avoiding"),
        List.of("competing", "accommodating"),
        List.of("collaborating", "avoiding")
    );

    private static final List<List<String>> COMMUNICATION_FRICTION = List.of(
        List.of("direct", "indirect"),
        List.of("analytical", "indirect")
    );

    private static final List<List<String>> VALUE_CONFLICTS = List.of(
        List.of("innovation", "stability"),
        List.of("competition", "collaboration"),
        List.of("autonomy", "teamwork"),
        List.of("speed", "quality"),
        List.of("transparency", "privacy")
    );

    private static final Map<String, List<String>> MITIGATIONS = Map.of(
        RESOLUTION_MISMATCH, List.of(
            "Establish clear conflict resolution protocols",
            "Create safe spaces for both direct and indirect communication",
            "Use a mediator for important disagreements",
            "Set ground rules that respect different styles",
            "Schedule regular check-ins to prevent issue buildup"),
        EMPATHY_GAP, List.of(
            "Implement structured empathy-building exercises",
            "Create opportunities for personal story sharing",
            "Use perspective-taking activities in meetings",
            "Establish emotional check-in rituals",
            "Provide empathy training resources"),
        ENERGY_IMBALANCE, List.of(
            "Balance meeting formats (large group vs small)",
            "Offer multiple participation channels (verbal, written, async)",
            "Create quiet reflection time in discussions",
            "Rotate leadership of activities",
            "Respect different energy recharge needs"),
        COMMUNICATION_CLASH, List.of(
            "Define clear communication protocols",
            "Use written summaries for important decisions",
            "Practice active listening techniques",
            "Clarify expectations explicitly",
            "Create communication preference profiles"),
        VALUE_MISALIGNMENT, List.of(
            "Find shared higher-order values",
            "Create space for value diversity discussions",
            "Focus on common goals despite different approaches",
            "Establish value-based decision criteria",
            "Celebrate diverse perspectives as strength"),
        EXPECTATION_DIVERGENCE, List.of(
            "Set explicit participation agreements",
            "Create flexible engagement options",
            "Define minimum and optional activities",
            "Regular expectation alignment discussions",
            "Document and revisit group norms"),
        LEADERSHIP_CONFLICT, List.of(
            "Rotate leadership responsibilities",
            "Define clear roles and domains",
            "Use collaborative decision-making processes",
            "Channel leadership energy into complementary areas",
            "Establish shared leadership model"),
        WORK_STYLE_FRICTION, List.of(
            "Create process flexibility options",
            "Balance structure with adaptability",
            "Use hybrid planning approaches",
            "Respect different work rhythms",
            "Define outcome focus over process")
    );

    static final List<String> GENERIC_MITIGATIONS = List.of(
        "Foster open communication",
        "Build mutual understanding",
        "Focus on shared goals",
        "Practice patience and respect"
    );

    /**
     * Run every rule and return the fired risks, highest risk score first.
     */
    public List<ConflictRisk> predict(List<MemberProfile> members) {
        if (members == null || members.size() < 2) {
            log.warn("Insufficient members for conflict prediction: {}", members == null ? 0 : members.size());
            return List.of();
        }

        List<ConflictRisk> risks = new ArrayList<>();
        risks.addAll(detectResolutionMismatch(members));
        risks.addAll(detectEmpathyGap(members));
        risks.addAll(detectEnergyImbalance(members));
        risks.addAll(detectCommunicationClash(members));
        risks.addAll(detectValueConflicts(members));
        risks.addAll(detectExpectationDivergence(members));
        risks.addAll(detectLeadershipConflict(members));
        risks.addAll(detectWorkStyleFriction(members));

        List<ConflictRisk> mitigated = risks.stream()
            .map(risk -> risk.toBuilder().mitigationStrategies(mitigationsFor(risk.getType())).build())
            .sorted(Comparator.comparingDouble(ConflictRisk::getRiskScore).reversed())
            .collect(Collectors.toList());

        log.debug("Risk prediction found {} risks across {} members", mitigated.size(), members.size());
        return mitigated;
    }

    public static List<String> mitigationsFor(String type) {
        return MITIGATIONS.getOrDefault(type, GENERIC_MITIGATIONS);
    }

    /**
     * Mismatch probability: rewards balanced group sizes on both sides of a divide
     */
    static double mismatchProbability(int countA, int countB, int total) {
        double propA = (double) countA / total;
        double propB = (double) countB / total;
        return Math.min(propA * propB * 2 * (1 - Math.abs(propA - propB)), 0.95);
    }

    List<ConflictRisk> detectResolutionMismatch(List<MemberProfile> members) {
        Map<String, List<String>> styles = groupBy(members, MemberProfile::conflictStyle);
        List<ConflictRisk> risks = new ArrayList<>();
        for (List<String> pair : STYLE_CONFLICTS) {
            List<String> sideA = styles.get(pair.get(0));
            List<String> sideB = styles.get(pair.get(1));
            if (sideA == null || sideB == null) {
                continue;
            }
            risks.add(risk(RESOLUTION_MISMATCH, concat(sideA, sideB),
                String.format("Group has both %s (%d members) and %s (%d members) conflict resolution styles. "
                        + "This can lead to unresolved tensions when %s members want to address issues while %s "
                        + "members withdraw.", pair.get(0), sideA.size(), pair.get(1), sideB.size(),
                    pair.get(0), pair.get(1)),
                List.of("Team disagreements", "Project conflicts", "Resource allocation disputes",
                    "Priority setting discussions"),
                mismatchProbability(sideA.size(), sideB.size(), members.size()), RESOLUTION_IMPACT));
        }
        return risks;
    }

    List<ConflictRisk> detectEmpathyGap(List<MemberProfile> members) {
        Map<String, Double> levels = new LinkedHashMap<>();
        members.forEach(m -> m.empathyLevel().ifPresent(level -> levels.put(m.getUserId(), level)));
        if (levels.size() < 2) {
            return List.of();
        }

        double mean = levels.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = levels.values().stream().mapToDouble(l -> (l - mean) * (l - mean)).average().orElse(0.0);
        double stdDev = Math.sqrt(variance);
        if (stdDev <= EMPATHY_STDDEV_THRESHOLD) {
            return List.of();
        }

        List<String> high = levels.entrySet().stream()
            .filter(e -> e.getValue() > mean + stdDev).map(Map.Entry::getKey).collect(Collectors.toList());
        List<String> low = levels.entrySet().stream()
            .filter(e -> e.getValue() < mean - stdDev).map(Map.Entry::getKey).collect(Collectors.toList());
        if (high.isEmpty() || low.isEmpty()) {
            return List.of();
        }

        return List.of(risk(EMPATHY_GAP, concat(high, low),
            String.format("Significant empathy gap detected. %d members show high empathy (above %.0f) while %d "
                    + "members show low empathy (below %.0f). This can lead to misunderstandings and hurt feelings.",
                high.size(), mean + stdDev, low.size(), Math.max(0, mean - stdDev)),
            List.of("Emotional discussions", "Personal feedback sessions", "Support requests",
                "Team bonding activities"),
            0.7, EMPATHY_IMPACT));
    }

    List<ConflictRisk> detectEnergyImbalance(List<MemberProfile> members) {
        List<Double> energies = new ArrayList<>();
        members.forEach(m -> m.socialEnergy().ifPresent(energies::add));
        if (energies.size() < 3) {
            return List.of();
        }

        long high = energies.stream().filter(e -> e > 70).count();
        long low = energies.stream().filter(e -> e < 30).count();
        int total = energies.size();
        List<String> everyone = members.stream().map(MemberProfile::getUserId).collect(Collectors.toList());

        if ((double) high / total > 0.8) {
            return List.of(risk(ENERGY_IMBALANCE, everyone,
                String.format("Group is dominated by high-energy extroverts (%d/%d). May lack reflection time and "
                    + "overwhelm quieter voices.", high, total),
                List.of("Long meetings", "Brainstorming sessions", "Social events", "Collaborative work"),
                0.6, ENERGY_IMPACT));
        }
        if ((double) low / total > 0.8) {
            return List.of(risk(ENERGY_IMBALANCE, everyone,
                String.format("Group is dominated by low-energy introverts (%d/%d). May struggle with group dynamics "
                    + "and spontaneous collaboration.", low, total),
                List.of("Group presentations", "Networking requirements", "Open discussions", "Team building"),
                0.6, ENERGY_IMPACT));
        }
        return List.of();
    }

    List<ConflictRisk> detectCommunicationClash(List<MemberProfile> members) {
        Map<String, List<String>> styles = groupBy(members, MemberProfile::communicationStyle);
        List<ConflictRisk> risks = new ArrayList<>();
        for (List<String> pair : COMMUNICATION_FRICTION) {
            List<String> sideA = styles.get(pair.get(0));
            List<String> sideB = styles.get(pair.get(1));
            if (sideA == null || sideB == null) {
                continue;
            }
            risks.add(risk(COMMUNICATION_CLASH, concat(sideA, sideB),
                String.format("Communication style mismatch between %s communicators (%d) and %s communicators (%d). "
                        + "May lead to misunderstandings and frustration.",
                    pair.get(0), sideA.size(), pair.get(1), sideB.size()),
                List.of("Important announcements", "Feedback sessions", "Project updates", "Decision discussions"),
                mismatchProbability(sideA.size(), sideB.size(), members.size()), COMMUNICATION_IMPACT));
        }
        return risks;
    }

    List<ConflictRisk> detectValueConflicts(List<MemberProfile> members) {
        Map<String, Set<String>> valuesByMember = new LinkedHashMap<>();
        for (MemberProfile member : members) {
            Set<String> values = new LinkedHashSet<>();
            member.coreValues().forEach(v -> values.add(v.trim().toLowerCase(Locale.ROOT)));
            valuesByMember.put(member.getUserId(), values);
        }

        List<ConflictRisk> risks = new ArrayList<>();
        for (List<String> pair : VALUE_CONFLICTS) {
            String valueA = pair.get(0);
            String valueB = pair.get(1);
            long countA = valuesByMember.values().stream().filter(v -> v.contains(valueA)).count();
            long countB = valuesByMember.values().stream().filter(v -> v.contains(valueB)).count();
            if (countA == 0 || countB == 0) {
                continue;
            }
            List<String> affected = valuesByMember.entrySet().stream()
                .filter(e -> e.getValue().contains(valueA) || e.getValue().contains(valueB))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
            double probability = (double) (countA + countB) / (members.size() * 2);

            risks.add(risk(VALUE_MISALIGNMENT, affected,
                String.format("Value conflict between \"%s\" (%d members) and \"%s\" (%d members). This fundamental "
                    + "difference can create tension in decision-making.", valueA, countA, valueB, countB),
                List.of("Strategic planning", "Priority setting", "Resource allocation", "Culture discussions"),
                probability, VALUE_IMPACT));
        }
        return risks;
    }

    List<ConflictRisk> detectExpectationDivergence(List<MemberProfile> members) {
        List<String> highCommitment = new ArrayList<>();
        List<String> lowCommitment = new ArrayList<>();
        for (MemberProfile member : members) {
            OptionalDouble energy = member.socialEnergy();
            boolean high = above(member.driverStrength("achievement"), 0.7)
                || (energy.isPresent() && energy.getAsDouble() > 70);
            boolean low = above(member.driverStrength("autonomy"), 0.7)
                || (energy.isPresent() && energy.getAsDouble() < 30);
            if (high) {
                highCommitment.add(member.getUserId());
            } else if (low) {
                lowCommitment.add(member.getUserId());
            }
        }
        if (highCommitment.isEmpty() || lowCommitment.isEmpty()) {
            return List.of();
        }

        return List.of(risk(EXPECTATION_DIVERGENCE, concat(highCommitment, lowCommitment),
            String.format("Different expectations for group participation. %d members expect high engagement while "
                + "%d prefer minimal commitment.", highCommitment.size(), lowCommitment.size()),
            List.of("Meeting frequency", "Response time expectations", "Participation requirements",
                "Commitment levels"),
            0.6, EXPECTATION_IMPACT));
    }

    List<ConflictRisk> detectLeadershipConflict(List<MemberProfile> members) {
        List<String> leaders = members.stream()
            .filter(m -> above(m.tendencyLikelihood("leadership"), 0.7)
                || above(m.driverStrength("power"), 0.7)
                || m.conflictStyle().filter("competing"::equals).isPresent())
            .map(MemberProfile::getUserId)
            .collect(Collectors.toList());
        if (leaders.size() < LEADERSHIP_THRESHOLD) {
            return List.of();
        }

        return List.of(risk(LEADERSHIP_CONFLICT, leaders,
            String.format("Multiple strong leadership personalities (%d) may compete for influence and "
                + "direction-setting.", leaders.size()),
            List.of("Decision making", "Project leadership", "Strategic planning", "Crisis situations"),
            (double) leaders.size() / members.size(), LEADERSHIP_IMPACT));
    }

    List<ConflictRisk> detectWorkStyleFriction(List<MemberProfile> members) {
        List<String> systematic = new ArrayList<>();
        List<String> adaptive = new ArrayList<>();
        for (MemberProfile member : members) {
            boolean isSystematic = member.problemSolvingStyle().filter("systematic"::equals).isPresent()
                || member.decisionMakingStyle().filter("analytical"::equals).isPresent();
            boolean isAdaptive = member.problemSolvingStyle().filter("intuitive"::equals).isPresent()
                || member.decisionMakingStyle().filter("spontaneous"::equals).isPresent();
            if (isSystematic) {
                systematic.add(member.getUserId());
            } else if (isAdaptive) {
                adaptive.add(member.getUserId());
            }
        }
        if (systematic.isEmpty() || adaptive.isEmpty()) {
            return List.of();
        }

        double imbalance = (double) Math.abs(systematic.size() - adaptive.size()) / (systematic.size() + adaptive.size());
        if (imbalance <= 0.3) {
            return List.of();
        }

        return List.of(risk(WORK_STYLE_FRICTION, concat(systematic, adaptive),
            String.format("Work style differences between systematic planners (%d) and adaptive improvisers (%d).",
                systematic.size(), adaptive.size()),
            List.of("Project planning", "Deadline management", "Process definition", "Documentation requirements"),
            0.5, WORK_STYLE_IMPACT));
    }

    /**
     * Severity counts, overall level and headline recommendations for a risk list
     * already sorted by {@link #predict(List)}.
     */
    public RiskSummary summarize(List<ConflictRisk> risks) {
        Map<RiskSeverity, Long> counts = risks.stream()
            .collect(Collectors.groupingBy(ConflictRisk::getSeverity, Collectors.counting()));
        int critical = counts.getOrDefault(RiskSeverity.CRITICAL, 0L).intValue();
        int high = counts.getOrDefault(RiskSeverity.HIGH, 0L).intValue();
        int medium = counts.getOrDefault(RiskSeverity.MEDIUM, 0L).intValue();
        int low = counts.getOrDefault(RiskSeverity.LOW, 0L).intValue();

        String level;
        if (critical > 0) {
            level = "Critical attention needed";
        } else if (high > 2) {
            level = "High risk - proactive intervention recommended";
        } else if (medium > 3) {
            level = "Moderate risk - monitoring advised";
        } else {
            level = "Low risk - healthy dynamics";
        }

        List<String> recommendations = new ArrayList<>();
        if (critical > 0) {
            recommendations.add("Address critical risks immediately with group discussion");
        }
        if (hasType(risks, RESOLUTION_MISMATCH)) {
            recommendations.add("Establish conflict resolution protocols");
        }
        if (hasType(risks, COMMUNICATION_CLASH)) {
            recommendations.add("Create communication guidelines and norms");
        }
        if (hasType(risks, VALUE_MISALIGNMENT)) {
            recommendations.add("Facilitate values alignment workshop");
        }

        return RiskSummary.builder()
            .criticalCount(critical)
            .highCount(high)
            .mediumCount(medium)
            .lowCount(low)
            .topRisk(risks.isEmpty() ? null : risks.get(0))
            .overallRiskLevel(level)
            .recommendations(recommendations)
            .build();
    }

    private static boolean hasType(List<ConflictRisk> risks, String type) {
        return risks.stream().anyMatch(r -> type.equals(r.getType()));
    }

    private static Map<String, List<String>> groupBy(List<MemberProfile> members,
                                                     Function<MemberProfile, Optional<String>> style) {
        Map<String, List<String>> styles = new LinkedHashMap<>();
        for (MemberProfile member : members) {
            style.apply(member)
                .ifPresent(value -> styles.computeIfAbsent(value, k -> new ArrayList<>()).add(member.getUserId()));
        }
        return styles;
    }

    private static boolean above(OptionalDouble value, double threshold) {
        return value.isPresent() && value.getAsDouble() > threshold;
    }

    private static List<String> concat(List<String> a, List<String> b) {
        List<String> all = new ArrayList<>(a.size() + b.size());
        all.addAll(a);
        all.addAll(b);
        return all;
    }

    private static ConflictRisk risk(String type, List<String> affected, String description, List<String> triggers,
                                     double probability, double impact) {
        String seed = type + ":" + String.join(",", affected) + ":" + description;
        return ConflictRisk.builder()
            .id(UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString())
            .type(type)
            .affectedMembers(affected)
            .description(description)
            .triggers(triggers)
            .probability(probability)
            .impact(impact)
            .build();
    }
}
