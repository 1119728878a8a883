package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Five category scores in {@link ScoreCategory} order. The total is always derived from them.
 */
@Value
@Builder
public class ScoreReport {

    public static final int MAX_TOTAL = 100;

    List<CategoryScore> categories;
    GradeTier grade;

    public int getTotalPoints() {
        return totalOf(categories);
    }

    public CategoryScore category(ScoreCategory category) {
        return categories.stream()
                .filter(score -> score.getCategory() == category)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No score for category " + category));
    }

    public static int totalOf(List<CategoryScore> categories) {
        int sum = categories.stream().mapToInt(CategoryScore::getPointsEarned).sum();
        return Math.max(0, Math.min(MAX_TOTAL, sum));
    }
}
