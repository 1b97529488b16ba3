package com.mirrorgroups.insights.synthesis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorgroups.insights.exception.SynthesisException;
import com.mirrorgroups.insights.model.insight.NarrativeSynthesis;
import com.mirrorgroups.insights.model.insight.Narratives;
import com.mirrorgroups.insights.model.insight.SynthesisStrategy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses and validates the structured synthesis returned by the language model.
 *
 * <p>There is no partial acceptance: a response that is not JSON or lacks any required
 * field raises {@link SynthesisException}.
 */
@Component
@RequiredArgsConstructor
public class SynthesisResponseParser {

    static final String[] NARRATIVE_SECTIONS = {"compatibility", "strengths", "challenges", "opportunities"};

    private final ObjectMapper objectMapper;

    public NarrativeSynthesis parse(String completion) {
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(completion));
        } catch (JsonProcessingException e) {
            throw new SynthesisException("Synthesis response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new SynthesisException("Synthesis response is not a JSON object");
        }

        String overview = requireText(root, "overview");
        List<String> keyInsights = requireTextList(root, "keyInsights");
        List<String> recommendations = requireTextList(root, "recommendations");

        JsonNode narratives = root.path("narratives");
        if (!narratives.isObject()) {
            throw new SynthesisException("Synthesis response is missing narratives");
        }
        for (String section : NARRATIVE_SECTIONS) {
            requireText(narratives, section);
        }

        return NarrativeSynthesis.builder()
            .overview(overview)
            .keyInsights(keyInsights)
            .recommendations(recommendations)
            .narratives(Narratives.builder()
                .compatibility(narratives.get("compatibility").asText())
                .strengths(narratives.get("strengths").asText())
                .challenges(narratives.get("challenges").asText())
                .opportunities(narratives.get("opportunities").asText())
                .build())
            .strategy(SynthesisStrategy.REMOTE)
            .build();
    }

    static String stripCodeFence(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, closing).trim();
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new SynthesisException("Synthesis response is missing " + field);
        }
        return value.asText();
    }

    private static List<String> requireTextList(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isArray() || value.isEmpty()) {
            throw new SynthesisException("Synthesis response is missing " + field);
        }
        List<String> items = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw new SynthesisException("Synthesis response has a non-text entry in " + field);
            }
            items.add(item.asText());
        }
        return items;
    }
}
