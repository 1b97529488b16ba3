package com.mirrorgroups.insights.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Best-effort conversion of older profile shapes into the current one.
 *
 * <p>Older shares carry raw Big Five trait scores instead of an embedding, a verbal
 * empathy level instead of a number, and IQ-style cognitive data without styles. The
 * conversion is lossy and is not authoritative:
 * <ul>
 *   <li>the embedding is the five trait scores divided by 100; a missing trait counts as 50</li>
 *   <li>social energy is taken from extraversion, on the same 0-100 scale</li>
 *   <li>communication, conflict and cognitive styles are copied only when the legacy
 *       record declares them, otherwise they stay absent</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LegacyProfileTransformer {

    private static final String[] BIG_FIVE = {
        "openness", "conscientiousness", "extraversion", "agreeableness", "neuroticism"
    };

    private static final Map<String, Double> EMPATHY_WORDS = Map.of(
        "low", 30.0,
        "moderate", 50.0,
        "medium", 50.0,
        "high", 70.0,
        "very high", 90.0
    );

    private final ObjectMapper objectMapper;

    public boolean isLegacyPersonality(JsonNode personality) {
        return personality != null && personality.hasNonNull("bigFive") && !personality.hasNonNull("embedding");
    }

    public boolean isLegacyCognitive(JsonNode cognitive) {
        return cognitive != null && cognitive.hasNonNull("iqScore") && !cognitive.hasNonNull("problemSolvingStyle");
    }

    public boolean isLegacyFullProfile(JsonNode profile) {
        return profile != null && isLegacyPersonality(profile.get("personality"));
    }

    /**
     * Personality share: {bigFive, mbti, communicationStyle?, conflictResolutionStyle?}
     */
    public ObjectNode transformPersonality(JsonNode legacy) {
        JsonNode bigFive = legacy.path("bigFive");
        ObjectNode personality = objectMapper.createObjectNode();
        personality.set("embedding", embedding(bigFive));
        personality.set("traits", bigFive.deepCopy());
        copyText(legacy, "mbti", personality, "interpersonalStyle");
        copyText(legacy, "communicationStyle", personality, "communicationStyle");
        copyText(legacy, "conflictResolutionStyle", personality, "conflictResolutionStyle");
        log.debug("Transformed legacy personality share");
        return personality;
    }

    /**
     * Cognitive share: {iqScore, category, strengths}. No styles can be inferred.
     */
    public ObjectNode transformCognitive(JsonNode legacy) {
        ObjectNode cognitive = objectMapper.createObjectNode();
        copyText(legacy, "decisionMakingStyle", cognitive, "decisionMakingStyle");
        copyText(legacy, "learningStyle", cognitive, "learningStyle");
        log.debug("Transformed legacy cognitive share; styles left absent");
        return cognitive;
    }

    /**
     * Full profile: {personality: {bigFive, mbti, dominantTraits}, communication: {style},
     * collaboration: {conflictStyle, empathyLevel}, cognitive}
     */
    public ObjectNode transformFullProfile(JsonNode legacy) {
        JsonNode legacyPersonality = legacy.path("personality");
        JsonNode bigFive = legacyPersonality.path("bigFive");
        JsonNode communication = legacy.path("communication");
        JsonNode collaboration = legacy.path("collaboration");

        ObjectNode profile = objectMapper.createObjectNode();

        ObjectNode personality = profile.putObject("personality");
        personality.set("embedding", embedding(bigFive));
        personality.set("traits", bigFive.deepCopy());
        copyText(legacyPersonality, "mbti", personality, "interpersonalStyle");
        copyText(communication, "style", personality, "communicationStyle");
        copyText(collaboration, "conflictStyle", personality, "conflictResolutionStyle");

        JsonNode legacyCognitive = legacy.path("cognitive");
        if (legacyCognitive.isObject()) {
            profile.set("cognitive", isLegacyCognitive(legacyCognitive)
                ? transformCognitive(legacyCognitive)
                : legacyCognitive.deepCopy());
        }

        ObjectNode behavioral = profile.putObject("behavioral");
        if (bigFive.path("extraversion").isNumber()) {
            behavioral.put("socialEnergy", bigFive.get("extraversion").asDouble());
        }
        JsonNode empathy = collaboration.path("empathyLevel");
        if (empathy.isNumber()) {
            behavioral.put("empathyLevel", empathy.asDouble());
        } else if (empathy.isTextual()) {
            Double level = EMPATHY_WORDS.get(empathy.asText().trim().toLowerCase(Locale.ROOT));
            if (level != null) {
                behavioral.put("empathyLevel", level);
            }
        }

        JsonNode dominantTraits = legacyPersonality.path("dominantTraits");
        if (dominantTraits.isArray() && dominantTraits.size() > 0) {
            profile.putObject("values").set("coreValues", dominantTraits.deepCopy());
        }

        log.debug("Transformed legacy full profile");
        return profile;
    }

    private ArrayNode embedding(JsonNode bigFive) {
        ArrayNode embedding = objectMapper.createArrayNode();
        for (String trait : BIG_FIVE) {
            JsonNode score = bigFive.path(trait);
            embedding.add((score.isNumber() ? score.asDouble() : 50.0) / 100.0);
        }
        return embedding;
    }

    private static void copyText(JsonNode source, String sourceField, ObjectNode target, String targetField) {
        JsonNode value = source.path(sourceField);
        if (value.isTextual() && !value.asText().isBlank()) {
            target.put(targetField, value.asText());
        }
    }
}
