package com.mirrorgroups.insights.model.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Decrypted, normalized data one member shared with a group.
 *
 * <p>Each sub-record is independently optional. The accessor methods below are the
 * only way engines read profile data: a missing sub-record or scalar comes back as an
 * empty {@code Optional}/{@code OptionalDouble} or an empty list, never as zero.
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
@Builder(toBuilder = true)
@Jacksonized
public class MemberProfile {

    String userId;

    Instant sharedAt;

    List<String> sharedDataTypes;

    PersonalityProfile personality;

    BehavioralProfile behavioral;

    CognitiveProfile cognitive;

    ValuesProfile values;

    public Optional<List<Double>> embedding() {
        if (personality == null || personality.getEmbedding() == null || personality.getEmbedding().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(personality.getEmbedding());
    }

    public boolean hasTraits() {
        return personality != null && personality.getTraits() != null && !personality.getTraits().isEmpty();
    }

    public Optional<String> communicationStyle() {
        return personality == null ? Optional.empty() : normalize(personality.getCommunicationStyle());
    }

    public Optional<String> conflictStyle() {
        return personality == null ? Optional.empty() : normalize(personality.getConflictResolutionStyle());
    }

    public boolean hasTendencies() {
        return behavioral != null && behavioral.getTendencies() != null && !behavioral.getTendencies().isEmpty();
    }

    public List<BehavioralTendency> tendencies() {
        return hasTendencies() ? behavioral.getTendencies() : Collections.emptyList();
    }

    public OptionalDouble socialEnergy() {
        return behavioral == null || behavioral.getSocialEnergy() == null
            ? OptionalDouble.empty()
            : OptionalDouble.of(behavioral.getSocialEnergy());
    }

    public OptionalDouble empathyLevel() {
        return behavioral == null || behavioral.getEmpathyLevel() == null
            ? OptionalDouble.empty()
            : OptionalDouble.of(behavioral.getEmpathyLevel());
    }

    public Optional<String> problemSolvingStyle() {
        return cognitive == null ? Optional.empty() : normalize(cognitive.getProblemSolvingStyle());
    }

    public Optional<String> decisionMakingStyle() {
        return cognitive == null ? Optional.empty() : normalize(cognitive.getDecisionMakingStyle());
    }

    public Optional<String> learningStyle() {
        return cognitive == null ? Optional.empty() : normalize(cognitive.getLearningStyle());
    }

    public List<String> coreValues() {
        return values == null || values.getCoreValues() == null ? Collections.emptyList() : values.getCoreValues();
    }

    public boolean hasMotivationDrivers() {
        return values != null && values.getMotivationDrivers() != null && !values.getMotivationDrivers().isEmpty();
    }

    public List<MotivationDriver> motivationDrivers() {
        return hasMotivationDrivers() ? values.getMotivationDrivers() : Collections.emptyList();
    }

    /**
     * Strength of the named motivation driver, matched case-insensitively
     */
    public OptionalDouble driverStrength(String driver) {
        return motivationDrivers().stream()
            .filter(d -> d.getDriver() != null && d.getDriver().equalsIgnoreCase(driver))
            .mapToDouble(MotivationDriver::getStrength)
            .findFirst();
    }

    /**
     * Highest likelihood among tendencies whose behavior name contains the fragment
     */
    public OptionalDouble tendencyLikelihood(String fragment) {
        String needle = fragment.toLowerCase(Locale.ROOT);
        return tendencies().stream()
            .filter(t -> t.getBehavior() != null && t.getBehavior().toLowerCase(Locale.ROOT).contains(needle))
            .mapToDouble(BehavioralTendency::getLikelihood)
            .max();
    }

    private static Optional<String> normalize(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim().toLowerCase(Locale.ROOT));
    }
}
