package com.raketman.resumeanalyzer.ai;

import com.raketman.resumeanalyzer.exception.AiNarrativeException;
import com.raketman.resumeanalyzer.model.AiConnectionStatus;
import com.raketman.resumeanalyzer.model.ResumeProfile;
import com.raketman.resumeanalyzer.model.ScoreReport;
import com.raketman.resumeanalyzer.model.Weakness;

import java.util.List;

/**
 * Remote prose generation over an already scored resume.
 */
public interface NarrativeGenerator {

    /**
     * Whether a provider is configured. The absent variant answers {@code false} and is never
     * asked to generate.
     */
    boolean isAvailable();

    /**
     * @param targetRole optional role to tailor the narrative to, may be {@code null}
     * @throws AiNarrativeException when the provider fails or returns nothing
     */
    String generate(ResumeProfile profile, ScoreReport report, String targetRole);

    /**
     * Action plan addressing the weakest categories, most severe first.
     * @throws AiNarrativeException when the provider fails or returns nothing
     */
    String improvementPlan(ResumeProfile profile, List<Weakness> weaknesses, String targetRole);

    /**
     * Round trip to the provider with a minimal request. Never throws.
     */
    AiConnectionStatus checkConnection();
}
