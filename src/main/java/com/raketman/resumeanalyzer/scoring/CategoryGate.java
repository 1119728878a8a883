package com.raketman.resumeanalyzer.scoring;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.raketman.resumeanalyzer.model.ResumeProfile;
import com.raketman.resumeanalyzer.model.RuleOutcome;
import com.raketman.resumeanalyzer.model.ScoreCategory;
import lombok.Builder;
import lombok.Value;

import java.util.function.Predicate;

/**
 * Precondition for scoring a category at all. When it fails the category earns zero and
 * carries this gate's reason alone.
 */
@Value
@Builder
public class CategoryGate {

    String id;
    ScoreCategory category;
    String reason;

    @JsonIgnore
    Predicate<ResumeProfile> predicate;

    public boolean isOpen(ResumeProfile profile) {
        return predicate.test(profile);
    }

    public RuleOutcome closedOutcome() {
        return RuleOutcome.builder()
                .ruleId(id)
                .met(false)
                .delta(0)
                .reason("0: " + reason)
                .build();
    }
}
