package com.raketman.resumeanalyzer.service;

import com.raketman.resumeanalyzer.config.AnalyzerTables;
import com.raketman.resumeanalyzer.exception.InvalidConfigurationException;
import com.raketman.resumeanalyzer.model.CategoryScore;
import com.raketman.resumeanalyzer.model.ResumeProfile;
import com.raketman.resumeanalyzer.model.RuleOutcome;
import com.raketman.resumeanalyzer.model.ScoreCategory;
import com.raketman.resumeanalyzer.scoring.CategoryGate;
import com.raketman.resumeanalyzer.scoring.ScoringRule;
import com.raketman.resumeanalyzer.scoring.ScoringRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores the five categories independently by evaluating each category's rules in order.
 */
@Service
public class CategoryScorer {

    private static final Logger logger = LoggerFactory.getLogger(CategoryScorer.class);

    private final AnalyzerTables tables;
    private final List<ScoringRule> rules;
    private final Map<ScoreCategory, CategoryGate> gates;

    @Autowired
    public CategoryScorer(AnalyzerTables tables) {
        this(tables, ScoringRules.defaults(tables), ScoringRules.gates());
    }

    public CategoryScorer(AnalyzerTables tables, List<ScoringRule> defaultRules, List<CategoryGate> gates) {
        this.tables = tables;
        this.rules = List.copyOf(applyOverrides(defaultRules, tables.getRulePoints()));
        this.gates = new EnumMap<>(ScoreCategory.class);
        gates.forEach(gate -> this.gates.put(gate.getCategory(), gate));
        validateReachable();
    }

    public List<CategoryScore> score(ResumeProfile profile) {
        List<CategoryScore> scores = new ArrayList<>();
        for (ScoreCategory category : ScoreCategory.values()) {
            scores.add(scoreCategory(category, profile));
        }
        return List.copyOf(scores);
    }

    private CategoryScore scoreCategory(ScoreCategory category, ResumeProfile profile) {
        int max = tables.maxPoints(category);
        CategoryGate gate = gates.get(category);
        if (gate != null && !gate.isOpen(profile)) {
            logger.debug("{} scored 0: {}", category, gate.getReason());
            return CategoryScore.builder()
                    .category(category)
                    .pointsEarned(0)
                    .maxPoints(max)
                    .outcomes(List.of(gate.closedOutcome()))
                    .build();
        }

        List<RuleOutcome> outcomes = rulesFor(category).stream()
                .map(rule -> rule.evaluate(profile))
                .collect(Collectors.toList());
        int earned = outcomes.stream().mapToInt(RuleOutcome::getDelta).sum();

        return CategoryScore.builder()
                .category(category)
                .pointsEarned(Math.min(max, Math.max(0, earned)))
                .maxPoints(max)
                .outcomes(List.copyOf(outcomes))
                .build();
    }

    public List<ScoringRule> getRules() {
        return rules;
    }

    public List<ScoringRule> rulesFor(ScoreCategory category) {
        return rules.stream()
                .filter(rule -> rule.getCategory() == category)
                .collect(Collectors.toList());
    }

    public List<CategoryGate> getGates() {
        return List.copyOf(gates.values());
    }

    private static List<ScoringRule> applyOverrides(List<ScoringRule> rules, Map<String, Integer> overrides) {
        Set<String> ids = rules.stream().map(ScoringRule::getId).collect(Collectors.toSet());
        for (String id : overrides.keySet()) {
            if (!ids.contains(id)) {
                throw new InvalidConfigurationException("resume.scoring.rule-points names unknown rule '" + id + "'");
            }
        }
        return rules.stream()
                .map(rule -> overrides.containsKey(rule.getId())
                        ? rule.toBuilder().points(overrides.get(rule.getId())).build()
                        : rule)
                .collect(Collectors.toList());
    }

    /**
     * A category whose rules cannot add up to its maximum could never be scored in full.
     */
    private void validateReachable() {
        for (ScoreCategory category : ScoreCategory.values()) {
            int available = rulesFor(category).stream().mapToInt(ScoringRule::getPoints).sum();
            int max = tables.maxPoints(category);
            if (available < max) {
                throw new InvalidConfigurationException(String.format(
                        "Rules for %s can award at most %d points but the category maximum is %d",
                        category, available, max));
            }
        }
    }
}
