package com.raketman.resumeanalyzer.ai;

import com.raketman.resumeanalyzer.exception.AiNarrativeException;
import com.raketman.resumeanalyzer.model.AiConnectionStatus;
import com.raketman.resumeanalyzer.model.ResumeProfile;
import com.raketman.resumeanalyzer.model.ScoreReport;
import com.raketman.resumeanalyzer.model.Weakness;

import java.util.List;

public class AbsentNarrativeGenerator implements NarrativeGenerator {

    private final String reason;

    public AbsentNarrativeGenerator() {
        this("No API key provided");
    }

    public AbsentNarrativeGenerator(String reason) {
        this.reason = reason;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String generate(ResumeProfile profile, ScoreReport report, String targetRole) {
        throw new AiNarrativeException("no AI provider configured");
    }

    @Override
    public String improvementPlan(ResumeProfile profile, List<Weakness> weaknesses, String targetRole) {
        throw new AiNarrativeException("no AI provider configured");
    }

    @Override
    public AiConnectionStatus checkConnection() {
        return AiConnectionStatus.invalid(reason);
    }
}
