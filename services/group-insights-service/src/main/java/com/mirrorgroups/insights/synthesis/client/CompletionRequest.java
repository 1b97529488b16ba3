package com.mirrorgroups.insights.synthesis.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CompletionRequest {

    String prompt;

    @JsonProperty("max_tokens")
    int maxTokens;

    double temperature;
}
