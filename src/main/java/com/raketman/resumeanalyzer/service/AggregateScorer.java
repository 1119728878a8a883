package com.raketman.resumeanalyzer.service;

import com.raketman.resumeanalyzer.config.AnalyzerTables;
import com.raketman.resumeanalyzer.model.CategoryScore;
import com.raketman.resumeanalyzer.model.GradeTier;
import com.raketman.resumeanalyzer.model.ScoreCategory;
import com.raketman.resumeanalyzer.model.ScoreReport;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class AggregateScorer {

    private final AnalyzerTables tables;

    public AggregateScorer(AnalyzerTables tables) {
        this.tables = tables;
    }

    public ScoreReport aggregate(List<CategoryScore> scores) {
        Set<ScoreCategory> seen = EnumSet.noneOf(ScoreCategory.class);
        for (CategoryScore score : scores) {
            if (!seen.add(score.getCategory())) {
                throw new IllegalArgumentException("Duplicate score for category " + score.getCategory());
            }
        }
        if (seen.size() != ScoreCategory.values().length) {
            throw new IllegalArgumentException("Expected one score per category but got " + seen);
        }

        List<CategoryScore> ordered = scores.stream()
                .sorted(Comparator.comparing(CategoryScore::getCategory))
                .collect(Collectors.toList());

        return ScoreReport.builder()
                .categories(List.copyOf(ordered))
                .grade(gradeFor(ScoreReport.totalOf(ordered)))
                .build();
    }

    /**
     * Highest tier whose lower bound the total reaches. Tiers are held in descending order and
     * always include one starting at zero.
     */
    public GradeTier gradeFor(int totalPoints) {
        return tables.getGradeTiers().stream()
                .filter(tier -> totalPoints >= tier.getMinPoints())
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No grade tier covers " + totalPoints));
    }
}
