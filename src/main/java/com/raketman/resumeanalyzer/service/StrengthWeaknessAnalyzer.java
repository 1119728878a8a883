package com.raketman.resumeanalyzer.service;

import com.raketman.resumeanalyzer.config.AnalyzerTables;
import com.raketman.resumeanalyzer.model.CategoryScore;
import com.raketman.resumeanalyzer.model.ResumeProfile;
import com.raketman.resumeanalyzer.model.ScoreReport;
import com.raketman.resumeanalyzer.model.Strength;
import com.raketman.resumeanalyzer.model.StrengthWeaknessReport;
import com.raketman.resumeanalyzer.model.Weakness;
import com.raketman.resumeanalyzer.model.WeaknessPriority;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns category ratios into strengths and weaknesses. Statements quote the scorer's own
 * reasons so they always agree with the numbers.
 */
@Service
public class StrengthWeaknessAnalyzer {

    private final AnalyzerTables tables;

    public StrengthWeaknessAnalyzer(AnalyzerTables tables) {
        this.tables = tables;
    }

    public StrengthWeaknessReport analyze(ResumeProfile profile, ScoreReport report) {
        List<Strength> strengths = new ArrayList<>();
        List<Weakness> weaknesses = new ArrayList<>();

        for (CategoryScore score : report.getCategories()) {
            double ratio = score.getRatio();
            String label = score.getCategory().getDisplayName();
            if (ratio >= tables.getStrengthRatio()) {
                strengths.add(Strength.builder()
                        .category(score.getCategory())
                        .ratio(ratio)
                        .statement(String.format("%s is strong (%d/%d)", label, score.getPointsEarned(), score.getMaxPoints()))
                        .evidence(score.metReasons())
                        .build());
            } else if (ratio < tables.getWeaknessRatio()) {
                weaknesses.add(Weakness.builder()
                        .category(score.getCategory())
                        .ratio(ratio)
                        .priority(ratio < tables.getCriticalRatio() ? WeaknessPriority.CRITICAL : WeaknessPriority.HIGH)
                        .statement(String.format("%s needs work (%d/%d)", label, score.getPointsEarned(), score.getMaxPoints()))
                        .details(score.unmetReasons())
                        .build());
            }
        }

        // stable sorts keep category order among equal ratios
        strengths.sort(Comparator.comparingDouble(Strength::getRatio).reversed());
        weaknesses.sort(Comparator.comparingDouble(Weakness::getRatio));

        return StrengthWeaknessReport.builder()
                .strengths(List.copyOf(strengths))
                .weaknesses(List.copyOf(weaknesses))
                .build();
    }
}
