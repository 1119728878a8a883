package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GradeTier {

    String name;
    int minPoints;
}
