package com.raketman.resumeanalyzer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisReport {

    ResumeProfile profile;
    ScoreReport scoreReport;
    List<RoleMatchResult> roleMatches;
    List<Strength> strengths;
    List<Weakness> weaknesses;
    AiInsight aiInsight;
    AiInsight improvementPlan;
}
