package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RequiredSkill {

    String skillId;
    String name;
    int weight;
}
