package com.mirrorgroups.insights.synthesis;

import com.mirrorgroups.insights.model.insight.CollectiveStrength;
import com.mirrorgroups.insights.model.insight.CompatibilityMatrix;
import com.mirrorgroups.insights.model.insight.ConflictRisk;
import com.mirrorgroups.insights.model.insight.GoalAlignment;
import com.mirrorgroups.insights.model.insight.GroupAnalysisResult;
import com.mirrorgroups.insights.model.insight.NarrativeSynthesis;
import com.mirrorgroups.insights.model.insight.Narratives;
import com.mirrorgroups.insights.model.insight.RiskSeverity;
import com.mirrorgroups.insights.model.insight.SynthesisStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Deterministic synthesis composed from the numeric insight data.
 *
 * <p>Used whenever the remote model is disabled or its circuit is open. The same input
 * always yields the same text.
 */
@Component
@Slf4j
public class TemplateNarrativeStrategy implements NarrativeStrategy {

    @Override
    public NarrativeSynthesis synthesize(GroupAnalysisResult result) {
        NarrativeSynthesis synthesis = NarrativeSynthesis.builder()
            .overview(overview(result))
            .keyInsights(keyInsights(result))
            .recommendations(recommendations(result))
            .narratives(Narratives.builder()
                .compatibility(compatibilityNarrative(result))
                .strengths(strengthsNarrative(result))
                .challenges(challengesNarrative(result))
                .opportunities(opportunitiesNarrative(result))
                .build())
            .strategy(SynthesisStrategy.TEMPLATE)
            .build();

        log.debug("Template synthesis for group {}: {} insights, {} recommendations",
            result.getGroupId(), synthesis.getKeyInsights().size(), synthesis.getRecommendations().size());
        return synthesis;
    }

    String overview(GroupAnalysisResult result) {
        List<CollectiveStrength> strengths = strengths(result);
        List<ConflictRisk> risks = risks(result);
        long critical = risks.stream().filter(r -> r.getSeverity() == RiskSeverity.CRITICAL).count();

        StringBuilder overview = new StringBuilder()
            .append("This ").append(result.getMemberCount()).append("-member group analysis reveals ")
            .append(level(averageCompatibility(result))).append(" interpersonal compatibility");

        if (!strengths.isEmpty()) {
            overview.append(" with ").append(strengths.size())
                .append(" identified collective strength").append(plural(strengths.size()));
        }
        if (!risks.isEmpty()) {
            overview.append(" and ").append(risks.size())
                .append(" potential conflict area").append(plural(risks.size()));
            if (critical > 0) {
                overview.append(" (").append(critical).append(" requiring immediate attention)");
            }
        } else {
            overview.append(" and healthy group dynamics with no significant conflict risks detected");
        }

        double confidence = result.getMetadata() != null ? result.getMetadata().getOverallConfidence() : 0.0;
        overview.append(". Analysis confidence: ").append(percent(confidence))
            .append("% based on ").append(percent(result.getDataCompleteness())).append("% data completeness.");
        return overview.toString();
    }

    List<String> keyInsights(GroupAnalysisResult result) {
        List<String> insights = new ArrayList<>();

        CompatibilityMatrix compatibility = result.getCompatibility();
        if (compatibility != null) {
            double average = compatibility.getAverageCompatibility();
            if (average >= 0.7) {
                insights.add("High group compatibility (" + percent(average)
                    + "%) creates strong foundation for collaboration");
            } else if (average < 0.5) {
                insights.add("Moderate compatibility challenges suggest need for structured communication protocols");
            }
        }

        List<CollectiveStrength> strengths = strengths(result);
        if (!strengths.isEmpty()) {
            CollectiveStrength top = strengths.get(0);
            insights.add("Collective strength in \"" + top.getName() + "\" present in "
                + percent(top.getPrevalence()) + "% of members");
        }

        List<ConflictRisk> risks = risks(result);
        if (!risks.isEmpty()) {
            ConflictRisk top = risks.get(0);
            insights.add("Primary conflict risk: " + humanize(top.getType()) + " ("
                + severity(top) + " severity)");
        }

        GoalAlignment alignment = result.getGoalAlignment();
        if (alignment != null) {
            long percent = percent(alignment.getOverallAlignment());
            if (percent >= 70) {
                insights.add("Strong goal alignment (" + percent + "%) indicates shared vision and purpose");
            } else if (percent < 40) {
                insights.add("Goal alignment needs attention (" + percent + "%) - clarify shared objectives");
            }
        }

        if (insights.isEmpty()) {
            insights.add("Group analysis complete - review detailed sections for specific insights");
        }
        return insights;
    }

    List<String> recommendations(GroupAnalysisResult result) {
        List<String> recommendations = new ArrayList<>();

        List<ConflictRisk> risks = risks(result);
        if (!risks.isEmpty()) {
            if (risks.stream().anyMatch(r -> r.getSeverity() == RiskSeverity.CRITICAL)) {
                recommendations.add("Address critical conflict risks immediately through facilitated group discussion");
            }
            List<String> mitigations = risks.get(0).getMitigationStrategies();
            if (!mitigations.isEmpty()) {
                recommendations.add(mitigations.get(0));
            }
        }

        CompatibilityMatrix compatibility = result.getCompatibility();
        if (compatibility != null && compatibility.getAverageCompatibility() < 0.6) {
            recommendations.add("Invest in team-building activities to improve interpersonal compatibility");
        }

        List<CollectiveStrength> strengths = strengths(result);
        if (!strengths.isEmpty()) {
            CollectiveStrength top = strengths.get(0);
            String application = top.getApplications() == null || top.getApplications().isEmpty()
                ? "group success"
                : humanize(top.getApplications().get(0));
            recommendations.add("Leverage collective strength in \"" + top.getName() + "\" for " + application);
        }

        if (recommendations.isEmpty()) {
            recommendations.add("Continue fostering open communication and mutual understanding");
            recommendations.add("Schedule regular group check-ins to maintain healthy dynamics");
        }
        return recommendations;
    }

    String compatibilityNarrative(GroupAnalysisResult result) {
        CompatibilityMatrix matrix = result.getCompatibility();
        if (matrix == null) {
            return "Compatibility analysis pending - awaiting member data.";
        }

        double average = matrix.getAverageCompatibility();
        int pairs = matrix.pairCount();
        String outlook;
        if (average >= 0.7) {
            outlook = "natural alignment that will facilitate smooth collaboration and mutual understanding.";
        } else if (average >= 0.5) {
            outlook = "solid foundation with some areas requiring conscious effort to bridge differences.";
        } else {
            outlook = "significant differences that will benefit from structured communication and team-building efforts.";
        }

        return "Compatibility analysis across " + pairs + " member pair" + plural(pairs)
            + " reveals an average compatibility score of " + percent(average) + "%. This "
            + level(average) + " compatibility level suggests " + outlook;
    }

    String strengthsNarrative(GroupAnalysisResult result) {
        List<CollectiveStrength> strengths = strengths(result);
        if (strengths.isEmpty()) {
            return "Collective strength analysis pending - awaiting sufficient member data.";
        }

        CollectiveStrength top = strengths.get(0);
        List<String> applications = top.getApplications() == null ? List.of() : top.getApplications();
        String opportunities = applications.isEmpty()
            ? "collaborative success"
            : applications.stream().limit(2).map(TemplateNarrativeStrategy::humanize).collect(Collectors.joining(" and "));

        StringBuilder narrative = new StringBuilder()
            .append("The group demonstrates notable collective strength in ").append(humanize(top.getName()))
            .append(", present in ").append(percent(top.getPrevalence()))
            .append("% of members. This shared capability creates opportunities for ").append(opportunities).append('.');

        if (strengths.size() > 1) {
            narrative.append(" Additional strengths include ")
                .append(strengths.stream().skip(1).limit(2)
                    .map(s -> humanize(s.getName()))
                    .collect(Collectors.joining(" and ")))
                .append('.');
        }
        return narrative.toString();
    }

    String challengesNarrative(GroupAnalysisResult result) {
        List<ConflictRisk> risks = risks(result);
        if (risks.isEmpty()) {
            return "No significant conflict risks identified - group shows healthy dynamics.";
        }

        ConflictRisk top = risks.get(0);
        int affected = top.getAffectedMembers().size();
        String trigger = top.getTriggers().isEmpty() ? "group activities" : top.getTriggers().get(0);
        String approach = top.getMitigationStrategies().isEmpty()
            ? "Proactive intervention recommended."
            : "Recommended approach: " + top.getMitigationStrategies().get(0);

        return "The primary challenge area involves " + humanize(top.getType()) + " with " + severity(top)
            + " severity. This affects " + affected + " member" + plural(affected)
            + " and may surface during " + trigger + ". " + approach;
    }

    String opportunitiesNarrative(GroupAnalysisResult result) {
        List<CollectiveStrength> strengths = strengths(result);
        GoalAlignment alignment = result.getGoalAlignment();
        if (strengths.isEmpty() && alignment == null) {
            return "Opportunities analysis pending - awaiting comprehensive member data.";
        }

        List<String> sentences = new ArrayList<>();
        if (alignment != null && alignment.getOverallAlignment() >= 0.6) {
            sentences.add("Strong goal alignment (" + percent(alignment.getOverallAlignment())
                + "%) presents opportunities for unified action toward shared objectives.");
        }
        if (!strengths.isEmpty()) {
            Set<String> applications = new LinkedHashSet<>();
            for (CollectiveStrength strength : strengths) {
                if (strength.getApplications() != null) {
                    strength.getApplications().forEach(a -> applications.add(humanize(a)));
                }
            }
            if (!applications.isEmpty()) {
                sentences.add("The group's collective strengths create natural opportunities in "
                    + applications.stream().limit(3).collect(Collectors.joining(", ")) + ".");
            }
        }
        if (sentences.isEmpty()) {
            return "The group shows potential for growth through continued collaboration and mutual support.";
        }
        return String.join(" ", sentences);
    }

    private static double averageCompatibility(GroupAnalysisResult result) {
        return result.getCompatibility() != null ? result.getCompatibility().getAverageCompatibility() : 0.0;
    }

    private static List<CollectiveStrength> strengths(GroupAnalysisResult result) {
        return result.getStrengths() != null ? result.getStrengths() : Collections.emptyList();
    }

    private static List<ConflictRisk> risks(GroupAnalysisResult result) {
        return result.getRisks() != null ? result.getRisks() : Collections.emptyList();
    }

    private static String level(double average) {
        if (average >= 0.7) {
            return "strong";
        }
        return average >= 0.5 ? "moderate" : "developing";
    }

    private static String severity(ConflictRisk risk) {
        return risk.getSeverity().name().toLowerCase(Locale.ROOT);
    }

    private static long percent(double ratio) {
        return Math.round(ratio * 100);
    }

    private static String plural(long count) {
        return count == 1 ? "" : "s";
    }

    private static String humanize(String tag) {
        return tag == null ? "" : tag.replace('_', ' ');
    }
}
