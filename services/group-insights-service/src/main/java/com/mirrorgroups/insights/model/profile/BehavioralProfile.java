package com.mirrorgroups.insights.model.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Behavioral portion of a member profile. Social energy and empathy are on a
 * 0-100 scale; null means the member did not share them.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
@Builder
@Jacksonized
public class BehavioralProfile {

    List<BehavioralTendency> tendencies;

    Double socialEnergy;

    Double empathyLevel;
}
