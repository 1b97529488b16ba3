package com.mirrorgroups.insights.engine;

import com.mirrorgroups.insights.model.insight.CollectiveStrength;
import com.mirrorgroups.insights.model.insight.StrengthCategory;
import com.mirrorgroups.insights.model.profile.BehavioralTendency;
import com.mirrorgroups.insights.model.profile.MemberProfile;
import com.mirrorgroups.insights.model.profile.MotivationDriver;
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
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Detects patterns shared by a qualifying share of the group.
 *
 * <p>A pattern qualifies when at least {@link #requiredMembers(int)} members exhibit it;
 * likelihood-bearing facts (behavioral tendencies, motivation drivers) additionally
 * need a per-member likelihood of at least {@link #MIN_LIKELIHOOD}. Four passes run on
 * every call: behavioral tendencies, style majorities, shared values and motivations,
 * and fixed emergent composites.
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@Component
@Slf4j
public class StrengthDetector {

    public static final int MIN_PREVALENCE_PERCENT = 60;
    public static final double MIN_LIKELIHOOD = 0.7;
    public static final int MIN_GROUP_SIZE = 2;
    public static final double STYLE_PATTERN_STRENGTH = 0.8;
    public static final double MAX_CONFIDENCE = 0.95;

    private static final Map<String, List<String>> PATTERN_APPLICATIONS = Map.ofEntries(
        Map.entry("active_listening", List.of("team_meetings", "conflict_resolution", "customer_service", "mentoring")),
        Map.entry("clear_articulation", List.of("presentations", "documentation", "teaching", "leadership")),
        Map.entry("emotional_validation", List.of("support", "team_building", "counseling", "relationships")),
        Map.entry("constructive_feedback", List.of("performance_reviews", "project_improvement", "skill_development")),
        Map.entry("consensus_building", List.of("decision_making", "project_planning", "team_alignment")),
        Map.entry("resource_sharing", List.of("knowledge_transfer", "skill_development", "efficiency")),
        Map.entry("inclusive_behavior", List.of("team_diversity", "innovation", "morale")),
        Map.entry("conflict_mediation", List.of("dispute_resolution", "team_harmony", "productivity")),
        Map.entry("initiative_taking", List.of("project_kickoff", "problem_solving", "innovation")),
        Map.entry("delegation", List.of("workload_management", "team_development", "scaling")),
        Map.entry("strategic_thinking", List.of("planning", "goal_setting", "vision_development")),
        Map.entry("motivating_others", List.of("team_performance", "engagement", "retention")),
        Map.entry("analytical_thinking", List.of("root_cause_analysis", "data_interpretation", "optimization")),
        Map.entry("creative_solutions", List.of("innovation", "product_development", "process_improvement")),
        Map.entry("systematic_approach", List.of("project_management", "quality_assurance", "implementation")),
        Map.entry("rapid_adaptation", List.of("crisis_management", "agile_development", "change_management")),
        Map.entry("empathy", List.of("customer_relations", "team_support", "user_experience")),
        Map.entry("trust_building", List.of("partnerships", "client_relations", "team_cohesion")),
        Map.entry("boundary_setting", List.of("work_life_balance", "professional_relationships", "productivity")),
        Map.entry("cultural_sensitivity", List.of("global_teams", "diversity", "inclusion"))
    );

    private static final Map<String, StrengthCategory> PATTERN_CATEGORIES = Map.ofEntries(
        Map.entry("active_listening", StrengthCategory.BEHAVIORAL),
        Map.entry("emotional_validation", StrengthCategory.BEHAVIORAL),
        Map.entry("inclusive_behavior", StrengthCategory.BEHAVIORAL),
        Map.entry("empathy", StrengthCategory.BEHAVIORAL),
        Map.entry("trust_building", StrengthCategory.BEHAVIORAL),
        Map.entry("boundary_setting", StrengthCategory.BEHAVIORAL),
        Map.entry("analytical_thinking", StrengthCategory.COGNITIVE),
        Map.entry("strategic_thinking", StrengthCategory.COGNITIVE),
        Map.entry("creative_solutions", StrengthCategory.COGNITIVE),
        Map.entry("systematic_approach", StrengthCategory.COGNITIVE),
        Map.entry("consensus_building", StrengthCategory.VALUE),
        Map.entry("resource_sharing", StrengthCategory.VALUE),
        Map.entry("cultural_sensitivity", StrengthCategory.VALUE),
        Map.entry("clear_articulation", StrengthCategory.SKILL),
        Map.entry("constructive_feedback", StrengthCategory.SKILL),
        Map.entry("delegation", StrengthCategory.SKILL),
        Map.entry("conflict_mediation", StrengthCategory.SKILL)
    );

    private static final Map<String, List<String>> COGNITIVE_APPLICATIONS = Map.of(
        "analytical", List.of("data_analysis", "research", "optimization", "quality_control"),
        "intuitive", List.of("innovation", "vision_development", "pattern_recognition"),
        "practical", List.of("implementation", "execution", "troubleshooting"),
        "creative", List.of("design", "brainstorming", "content_creation"),
        "systematic", List.of("process_improvement", "documentation", "standardization"),
        "adaptive", List.of("change_management", "crisis_response", "agile_development")
    );

    private static final Map<String, List<String>> COMMUNICATION_APPLICATIONS = Map.of(
        "direct", List.of("decision_making", "clear_expectations", "feedback"),
        "supportive", List.of("team_support", "onboarding", "conflict_resolution"),
        "analytical", List.of("planning", "problem_solving", "documentation"),
        "indirect", List.of("diplomacy", "sensitive_discussions", "relationship_building")
    );

    private static final Map<String, List<String>> VALUE_APPLICATIONS = Map.of(
        "integrity", List.of("trust_building", "ethical_decisions", "reputation"),
        "innovation", List.of("product_development", "problem_solving", "growth"),
        "collaboration", List.of("teamwork", "partnerships", "collective_success"),
        "excellence", List.of("quality_standards", "performance", "continuous_improvement"),
        "growth", List.of("learning", "development", "scaling"),
        "motivation_achievement", List.of("goal_setting", "performance", "results"),
        "motivation_affiliation", List.of("team_building", "relationships", "culture"),
        "motivation_power", List.of("leadership", "influence", "decision_making")
    );

    /**
     * Detect collective strengths.
     *
     * @return strengths ordered by prevalence x strength x confidence, descending;
     *         empty when fewer than two members are supplied
     */
    public List<CollectiveStrength> detect(List<MemberProfile> members) {
        if (members == null || members.size() < MIN_GROUP_SIZE) {
            log.warn("Insufficient members for strength detection: {}", members == null ? 0 : members.size());
            return List.of();
        }

        List<CollectiveStrength> patterns = new ArrayList<>();
        patterns.addAll(detectBehavioralPatterns(members));
        patterns.addAll(detectStylePatterns(members));
        patterns.addAll(detectValuePatterns(members));
        patterns.addAll(detectEmergentPatterns(members));

        // List.sort is stable, so equal weights keep pass order
        patterns.sort(Comparator.comparingDouble(CollectiveStrength::rankingWeight).reversed());

        int total = members.size();
        List<CollectiveStrength> described = new ArrayList<>(patterns.size());
        for (CollectiveStrength pattern : patterns) {
            described.add(pattern.toBuilder().description(describe(pattern, total)).build());
        }

        log.debug("Strength detection found {} patterns across {} members", described.size(), total);
        return described;
    }

    /**
     * Members needed for a pattern to qualify: ceil(60% of n)
     */
    public static int requiredMembers(int n) {
        return (n * MIN_PREVALENCE_PERCENT + 99) / 100;
    }

    List<CollectiveStrength> detectBehavioralPatterns(List<MemberProfile> members) {
        // pattern -> (member -> best likelihood)
        Map<String, Map<String, Double>> observed = new LinkedHashMap<>();
        for (MemberProfile member : members) {
            for (BehavioralTendency tendency : member.tendencies()) {
                if (tendency.getBehavior() == null || tendency.getLikelihood() < MIN_LIKELIHOOD) {
                    continue;
                }
                String pattern = normalizeName(tendency.getBehavior());
                if (pattern.isEmpty()) {
                    continue;
                }
                observed.computeIfAbsent(pattern, k -> new LinkedHashMap<>())
                    .merge(member.getUserId(), tendency.getLikelihood(), Math::max);
            }
        }

        List<CollectiveStrength> patterns = new ArrayList<>();
        int required = requiredMembers(members.size());
        observed.forEach((pattern, byMember) -> {
            if (byMember.size() >= required) {
                double meanLikelihood = byMember.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
                patterns.add(pattern(pattern,
                    PATTERN_CATEGORIES.getOrDefault(pattern, StrengthCategory.BEHAVIORAL),
                    byMember.size(), members.size(), meanLikelihood,
                    PATTERN_APPLICATIONS.getOrDefault(pattern, List.of())));
            }
        });
        return patterns;
    }

    List<CollectiveStrength> detectStylePatterns(List<MemberProfile> members) {
        Map<String, Set<String>> cognitive = new LinkedHashMap<>();
        Map<String, Set<String>> communication = new LinkedHashMap<>();
        for (MemberProfile member : members) {
            member.problemSolvingStyle().ifPresent(s -> addMember(cognitive, s, member));
            member.decisionMakingStyle().ifPresent(s -> addMember(cognitive, s, member));
            member.learningStyle().ifPresent(s -> addMember(cognitive, s, member));
            member.communicationStyle().ifPresent(s -> addMember(communication, s, member));
        }

        List<CollectiveStrength> patterns = new ArrayList<>();
        int required = requiredMembers(members.size());
        cognitive.forEach((style, holders) -> {
            if (holders.size() >= required) {
                patterns.add(pattern(normalizeName(style) + "_thinking", StrengthCategory.COGNITIVE,
                    holders.size(), members.size(), STYLE_PATTERN_STRENGTH,
                    COGNITIVE_APPLICATIONS.getOrDefault(style, List.of("problem_solving", "decision_making"))));
            }
        });
        communication.forEach((style, holders) -> {
            if (holders.size() >= required) {
                patterns.add(pattern(normalizeName(style) + "_communication", StrengthCategory.BEHAVIORAL,
                    holders.size(), members.size(), STYLE_PATTERN_STRENGTH,
                    COMMUNICATION_APPLICATIONS.getOrDefault(style, List.of("team_communication"))));
            }
        });
        return patterns;
    }

    List<CollectiveStrength> detectValuePatterns(List<MemberProfile> members) {
        Map<String, Map<String, Double>> observed = new LinkedHashMap<>();
        for (MemberProfile member : members) {
            for (String value : member.coreValues()) {
                String key = normalizeName(value);
                if (!key.isEmpty()) {
                    observed.computeIfAbsent(key, k -> new LinkedHashMap<>()).putIfAbsent(member.getUserId(), 1.0);
                }
            }
            for (MotivationDriver driver : member.motivationDrivers()) {
                if (driver.getDriver() == null || driver.getStrength() < MIN_LIKELIHOOD) {
                    continue;
                }
                String key = "motivation_" + normalizeName(driver.getDriver());
                observed.computeIfAbsent(key, k -> new LinkedHashMap<>())
                    .merge(member.getUserId(), driver.getStrength(), Math::max);
            }
        }

        List<CollectiveStrength> patterns = new ArrayList<>();
        int required = requiredMembers(members.size());
        observed.forEach((value, byMember) -> {
            if (byMember.size() >= required) {
                double meanStrength = byMember.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
                patterns.add(pattern(value, StrengthCategory.VALUE, byMember.size(), members.size(), meanStrength,
                    VALUE_APPLICATIONS.getOrDefault(value, List.of("group_culture", "decision_making"))));
            }
        });
        return patterns;
    }

    List<CollectiveStrength> detectEmergentPatterns(List<MemberProfile> members) {
        List<CollectiveStrength> patterns = new ArrayList<>();
        int required = requiredMembers(members.size());

        long highPerformers = count(members, m -> hasTendency(m, "initiative_taking")
            && hasTendency(m, "accountability")
            && hasTendency(m, "collaboration"));
        if (highPerformers >= required) {
            patterns.add(pattern("high_performing_team", StrengthCategory.BEHAVIORAL,
                (int) highPerformers, members.size(), 0.85,
                List.of("project_execution", "goal_achievement", "innovation")));
        }

        long creatives = count(members, m -> hasTendency(m, "creative_solutions")
            || (hasTendency(m, "openness") && m.problemSolvingStyle().filter("divergent"::equals).isPresent()));
        if (creatives >= required) {
            patterns.add(pattern("creative_collective", StrengthCategory.COGNITIVE,
                (int) creatives, members.size(), 0.80,
                List.of("brainstorming", "product_development", "problem_solving")));
        }

        long emotionallyIntelligent = count(members, m ->
            (m.empathyLevel().isPresent() && m.empathyLevel().getAsDouble() > 70)
                || (hasTendency(m, "emotional_validation") && hasTendency(m, "active_listening")));
        if (emotionallyIntelligent >= required) {
            patterns.add(pattern("emotional_intelligence", StrengthCategory.BEHAVIORAL,
                (int) emotionallyIntelligent, members.size(), 0.82,
                List.of("team_support", "client_relations", "conflict_resolution")));
        }
        return patterns;
    }

    static double confidence(double prevalence, double strength, int memberCount) {
        double raw = 0.4 * prevalence + 0.4 * strength + 0.2 * Math.min(memberCount / 10.0, 1.0);
        return Math.min(raw, MAX_CONFIDENCE);
    }

    static String normalizeName(String raw) {
        return raw.toLowerCase(Locale.ROOT)
            .trim()
            .replaceAll("\\s+", "_")
            .replaceAll("[^a-z0-9_]", "");
    }

    /**
     * "motivation_achievement" becomes "Achievement", "active_listening" becomes "Active Listening"
     */
    static String humanizeName(String name) {
        String spaced = name.replace('_', ' ').replace("motivation ", "").trim();
        StringBuilder out = new StringBuilder(spaced.length());
        boolean upperNext = true;
        for (char c : spaced.toCharArray()) {
            out.append(upperNext ? Character.toUpperCase(c) : c);
            upperNext = c == ' ';
        }
        return out.toString();
    }

    static String strengthLevel(double strength) {
        if (strength >= 0.9) return "exceptional";
        if (strength >= 0.8) return "strong";
        if (strength >= 0.7) return "solid";
        if (strength >= 0.6) return "moderate";
        return "developing";
    }

    private String describe(CollectiveStrength pattern, int totalMembers) {
        String name = humanizeName(pattern.getName());
        long percent = Math.round(pattern.getPrevalence() * 100);
        String application = Optional.ofNullable(pattern.getApplications())
            .filter(apps -> !apps.isEmpty())
            .map(apps -> apps.get(0).replace('_', ' '))
            .orElse("group activities");
        String level = strengthLevel(pattern.getStrength());

        switch (pattern.getCategory()) {
            case COGNITIVE:
                return String.format("%d%% of members share a %s cognitive style, indicating aligned thinking "
                    + "patterns that enhance %s.", percent, name, application);
            case VALUE:
                return String.format("%d out of %d members share %s as a core value or motivation, creating "
                    + "strong alignment in %s.", pattern.getMemberCount(), totalMembers, name, application);
            case SKILL:
                return String.format("The group shows collective competence in %s, with %d%% demonstrating this "
                    + "skill at %s proficiency.", name, percent, level);
            case BEHAVIORAL:
            default:
                return String.format("%d%% of the group consistently demonstrates %s behavior (%s strength). "
                    + "This collective tendency creates a strong foundation for %s.", percent, name, level, application);
        }
    }

    private CollectiveStrength pattern(String name, StrengthCategory category, int memberCount, int totalMembers,
                                       double strength, List<String> applications) {
        double prevalence = (double) memberCount / totalMembers;
        return CollectiveStrength.builder()
            .id(UUID.nameUUIDFromBytes(("strength:" + name).getBytes(StandardCharsets.UTF_8)).toString())
            .name(name)
            .category(category)
            .prevalence(prevalence)
            .strength(strength)
            .memberCount(memberCount)
            .confidence(confidence(prevalence, strength, memberCount))
            .applications(applications)
            .build();
    }

    private static boolean hasTendency(MemberProfile member, String behavior) {
        return member.tendencies().stream()
            .anyMatch(t -> t.getBehavior() != null
                && normalizeName(t.getBehavior()).equals(behavior)
                && t.getLikelihood() >= MIN_LIKELIHOOD);
    }

    private static void addMember(Map<String, Set<String>> counters, String key, MemberProfile member) {
        counters.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(member.getUserId());
    }

    private static long count(List<MemberProfile> members, Predicate<MemberProfile> predicate) {
        return members.stream().filter(predicate).count();
    }
}
