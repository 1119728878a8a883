package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QuantifiedClaim {

    int lineIndex;
    SectionKind sectionKind;
    MetricType metricType;
    double value;
    String text;
}
