package com.mirrorgroups.insights.model.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Personality portion of a member profile. Every field may be null.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
@Builder
@Jacksonized
public class PersonalityProfile {

    List<Double> embedding;

    Map<String, Double> traits;

    String interpersonalStyle;

    String communicationStyle;

    String conflictResolutionStyle;
}
