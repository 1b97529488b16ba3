package com.mirrorgroups.insights.model.insight;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Narratives {

    String compatibility;

    String strengths;

    String challenges;

    String opportunities;
}
