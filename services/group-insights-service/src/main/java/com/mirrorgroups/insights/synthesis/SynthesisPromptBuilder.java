package com.mirrorgroups.insights.synthesis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mirrorgroups.insights.exception.SynthesisException;
import com.mirrorgroups.insights.model.insight.CollectiveStrength;
import com.mirrorgroups.insights.model.insight.CompatibilityMatrix;
import com.mirrorgroups.insights.model.insight.ConflictRisk;
import com.mirrorgroups.insights.model.insight.GroupAnalysisResult;
import com.mirrorgroups.insights.model.insight.RiskSeverity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Builds the language model prompt from a summary of the analysis.
 *
 * <p>Only aggregates go into the prompt: member IDs and raw profile data never leave
 * the service.
 */
@Component
@RequiredArgsConstructor
public class SynthesisPromptBuilder {

    static final int TOP_ITEMS = 3;

    private static final String INSTRUCTIONS = String.join("\n",
        "You are an expert in group dynamics. Write a synthesis of the group analysis below.",
        "Respond with a single JSON object and nothing else, using exactly these fields:",
        "{\"overview\": string, \"keyInsights\": [string], \"recommendations\": [string],",
        " \"narratives\": {\"compatibility\": string, \"strengths\": string,",
        " \"challenges\": string, \"opportunities\": string}}",
        "Keep the overview to one paragraph and give at most five key insights and five recommendations.",
        "",
        "Analysis:");

    private final ObjectMapper objectMapper;

    public String build(GroupAnalysisResult result) {
        ObjectNode summary = objectMapper.createObjectNode();
        summary.put("memberCount", result.getMemberCount());
        summary.put("dataCompleteness", result.getDataCompleteness());
        if (result.getMetadata() != null) {
            summary.put("confidence", result.getMetadata().getOverallConfidence());
        }

        CompatibilityMatrix compatibility = result.getCompatibility();
        if (compatibility != null) {
            ObjectNode node = summary.putObject("compatibility");
            node.put("average", compatibility.getAverageCompatibility());
            node.put("cohesion", compatibility.getCohesionScore());
            node.put("pairCount", compatibility.pairCount());
            node.put("clusterCount", compatibility.getClusters() == null ? 0 : compatibility.getClusters().size());
        }

        List<CollectiveStrength> strengths = result.getStrengths();
        if (strengths != null) {
            ObjectNode node = summary.putObject("strengths");
            node.put("count", strengths.size());
            ArrayNode top = node.putArray("top");
            strengths.stream().limit(TOP_ITEMS).forEach(s -> top.addObject()
                .put("name", s.getName())
                .put("category", s.getCategory().name().toLowerCase(Locale.ROOT))
                .put("prevalence", s.getPrevalence()));
        }

        List<ConflictRisk> risks = result.getRisks();
        if (risks != null) {
            ObjectNode node = summary.putObject("risks");
            node.put("count", risks.size());
            node.put("criticalCount", risks.stream().filter(r -> r.getSeverity() == RiskSeverity.CRITICAL).count());
            ArrayNode top = node.putArray("top");
            risks.stream().limit(TOP_ITEMS).forEach(r -> top.addObject()
                .put("type", r.getType())
                .put("severity", r.getSeverity().name().toLowerCase(Locale.ROOT))
                .put("probability", r.getProbability()));
        }

        if (result.getGoalAlignment() != null) {
            ObjectNode node = summary.putObject("goalAlignment");
            node.put("overall", result.getGoalAlignment().getOverallAlignment());
            node.set("sharedGoals", objectMapper.valueToTree(result.getGoalAlignment().getSharedGoals()));
        }

        try {
            return INSTRUCTIONS + "\n" + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            throw new SynthesisException("Could not build synthesis prompt", e);
        }
    }
}
