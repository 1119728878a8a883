package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SkillToken {

    String id;
    String name;
    String rawText;
    SkillCategory category;
    MatchConfidence confidence;

    public boolean isExact() {
        return confidence == MatchConfidence.EXACT;
    }
}
