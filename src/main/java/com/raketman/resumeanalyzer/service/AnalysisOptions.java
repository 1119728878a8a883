package com.raketman.resumeanalyzer.service;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Per-request choices. An empty role list means every configured role; a {@code null} AI
 * timeout falls back to the configured one.
 */
@Value
@Builder
public class AnalysisOptions {

    @Builder.Default
    List<String> roles = List.of();

    boolean includeAi;

    boolean includeImprovementPlan;

    String targetRole;

    Duration aiTimeout;

    public static AnalysisOptions defaults() {
        return AnalysisOptions.builder().build();
    }
}
