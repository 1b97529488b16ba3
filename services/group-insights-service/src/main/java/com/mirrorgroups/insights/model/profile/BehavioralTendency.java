package com.mirrorgroups.insights.model.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
@Builder
@Jacksonized
public class BehavioralTendency {

    String behavior;

    /**
     * 0-1
     */
    double likelihood;

    List<String> contexts;
}
