package com.raketman.resumeanalyzer.scoring;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.raketman.resumeanalyzer.model.ResumeProfile;
import com.raketman.resumeanalyzer.model.RuleOutcome;
import com.raketman.resumeanalyzer.model.ScoreCategory;
import lombok.Builder;
import lombok.Value;

import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * One auditable scoring check. A met rule earns {@code points}; an unmet rule earns nothing and
 * reports the points forgone. Reason templates may contain {@code {n}}, replaced by the
 * observed metric.
 */
@Value
@Builder(toBuilder = true)
public class ScoringRule {

    String id;
    ScoreCategory category;
    int points;
    String metReason;
    String unmetReason;
    // used instead of unmetReason when the metric is zero
    String noneReason;

    @JsonIgnore
    Predicate<ResumeProfile> predicate;

    @JsonIgnore
    ToIntFunction<ResumeProfile> metric;

    public RuleOutcome evaluate(ResumeProfile profile) {
        boolean met = predicate.test(profile);
        Integer observed = metric != null ? metric.applyAsInt(profile) : null;
        String template;
        if (met) {
            template = metReason;
        } else if (noneReason != null && observed != null && observed == 0) {
            template = noneReason;
        } else {
            template = unmetReason;
        }
        String text = observed != null ? template.replace("{n}", String.valueOf(observed)) : template;
        return RuleOutcome.builder()
                .ruleId(id)
                .met(met)
                .delta(met ? points : 0)
                .reason((met ? "+" : "-") + points + ": " + text)
                .build();
    }
}
