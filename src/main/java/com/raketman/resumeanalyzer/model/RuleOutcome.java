package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RuleOutcome {

    String ruleId;
    boolean met;
    int delta;
    String reason;
}
