package com.mirrorgroups.insights.model.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
@Builder
@Jacksonized
public class MotivationDriver {

    String driver;

    /**
     * 0-1
     */
    double strength;
}
