package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class AiCostEstimate {

    int inputTokens;
    int outputTokens;
    int estimatedTokens;
    BigDecimal estimatedCostUsd;
    List<String> analysisTypes;
}
