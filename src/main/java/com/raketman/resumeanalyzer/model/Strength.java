package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Strength {

    ScoreCategory category;
    double ratio;
    String statement;
    List<String> evidence;
}
