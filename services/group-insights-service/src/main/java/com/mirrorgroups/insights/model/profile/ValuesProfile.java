package com.mirrorgroups.insights.model.profile;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
@Builder
@Jacksonized
public class ValuesProfile {

    @JsonAlias("core")
    List<String> coreValues;

    List<MotivationDriver> motivationDrivers;
}
