package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Weakness {

    ScoreCategory category;
    double ratio;
    WeaknessPriority priority;
    String statement;
    List<String> details;
}
