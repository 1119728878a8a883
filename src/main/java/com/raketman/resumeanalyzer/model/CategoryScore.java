package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
@Builder
public class CategoryScore {

    ScoreCategory category;
    int pointsEarned;
    int maxPoints;
    List<RuleOutcome> outcomes;

    public List<String> getReasons() {
        return outcomes.stream().map(RuleOutcome::getReason).collect(Collectors.toList());
    }

    public double getRatio() {
        return maxPoints == 0 ? 0.0 : (double) pointsEarned / maxPoints;
    }

    public List<String> metReasons() {
        return outcomes.stream()
                .filter(RuleOutcome::isMet)
                .map(RuleOutcome::getReason)
                .collect(Collectors.toList());
    }

    public List<String> unmetReasons() {
        return outcomes.stream()
                .filter(outcome -> !outcome.isMet())
                .map(RuleOutcome::getReason)
                .collect(Collectors.toList());
    }
}
