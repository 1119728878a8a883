package com.raketman.resumeanalyzer.service;

import com.raketman.resumeanalyzer.AnalyzerFixtures;
import com.raketman.resumeanalyzer.model.CategoryScore;
import com.raketman.resumeanalyzer.model.GradeTier;
import com.raketman.resumeanalyzer.model.RuleOutcome;
import com.raketman.resumeanalyzer.model.ScoreCategory;
import com.raketman.resumeanalyzer.model.ScoreReport;
import com.raketman.resumeanalyzer.model.Strength;
import com.raketman.resumeanalyzer.model.StrengthWeaknessReport;
import com.raketman.resumeanalyzer.model.Weakness;
import com.raketman.resumeanalyzer.model.WeaknessPriority;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StrengthWeaknessAnalyzerTest {

    private final StrengthWeaknessAnalyzer analyzer = new StrengthWeaknessAnalyzer(AnalyzerFixtures.tables());

    private static RuleOutcome met(String id, int points, String text) {
        return RuleOutcome.builder().ruleId(id).met(true).delta(points).reason("+" + points + ": " + text).build();
    }

    private static RuleOutcome unmet(String id, int points, String text) {
        return RuleOutcome.builder().ruleId(id).met(false).delta(0).reason("-" + points + ": " + text).build();
    }

    private static CategoryScore score(ScoreCategory category, int earned, int max, RuleOutcome... outcomes) {
        return CategoryScore.builder()
                .category(category)
                .pointsEarned(earned)
                .maxPoints(max)
                .outcomes(List.of(outcomes))
                .build();
    }

    private static ScoreReport report(CategoryScore... scores) {
        return ScoreReport.builder()
                .categories(List.of(scores))
                .grade(GradeTier.builder().name("Good").minPoints(60).build())
                .build();
    }

    @Test
    @DisplayName("high ratios become strengths backed by the rules that were met")
    void strengths() {
        StrengthWeaknessReport result = analyzer.analyze(null, report(
                score(ScoreCategory.CONTACT, 15, 15,
                        met("contact-email", 8, "valid email found"), met("contact-phone", 7, "valid phone number found")),
                score(ScoreCategory.SKILLS, 24, 30, met("skills-section", 4, "dedicated skills section present")),
                score(ScoreCategory.EXPERIENCE_QUALITY, 15, 25),
                score(ScoreCategory.QUANTIFIED_ACHIEVEMENTS, 10, 20),
                score(ScoreCategory.CONTENT_OPTIMIZATION, 5, 10)));

        assertThat(result.getStrengths()).extracting(Strength::getCategory)
                .containsExactly(ScoreCategory.CONTACT, ScoreCategory.SKILLS);
        Strength contact = result.getStrengths().get(0);
        assertThat(contact.getStatement()).isEqualTo("Contact Information is strong (15/15)");
        assertThat(contact.getEvidence()).containsExactly("+8: valid email found", "+7: valid phone number found");
        assertThat(result.getWeaknesses()).isEmpty();
    }

    @Test
    @DisplayName("low ratios become weaknesses, critical below the critical ratio, weakest first")
    void weaknesses() {
        StrengthWeaknessReport result = analyzer.analyze(null, report(
                score(ScoreCategory.CONTACT, 8, 15),
                score(ScoreCategory.SKILLS, 14, 30, unmet("skills-count-10", 4, "7 recognized skills, fewer than 10")),
                score(ScoreCategory.EXPERIENCE_QUALITY, 0, 25, RuleOutcome.builder()
                        .ruleId("experience-section").met(false).delta(0).reason("0: no experience section found").build()),
                score(ScoreCategory.QUANTIFIED_ACHIEVEMENTS, 6, 20),
                score(ScoreCategory.CONTENT_OPTIMIZATION, 10, 10)));

        assertThat(result.getWeaknesses()).extracting(Weakness::getCategory).containsExactly(
                ScoreCategory.EXPERIENCE_QUALITY, ScoreCategory.QUANTIFIED_ACHIEVEMENTS, ScoreCategory.SKILLS);
        assertThat(result.getWeaknesses()).extracting(Weakness::getPriority).containsExactly(
                WeaknessPriority.CRITICAL, WeaknessPriority.HIGH, WeaknessPriority.HIGH);
        assertThat(result.getWeaknesses().get(0).getDetails()).containsExactly("0: no experience section found");
        assertThat(result.getWeaknesses().get(2).getDetails()).containsExactly("-4: 7 recognized skills, fewer than 10");
        assertThat(result.getStrengths()).extracting(Strength::getCategory)
                .containsExactly(ScoreCategory.CONTENT_OPTIMIZATION);
    }

    @Test
    @DisplayName("middling categories are neither strengths nor weaknesses")
    void middleBand() {
        StrengthWeaknessReport result = analyzer.analyze(null, report(
                score(ScoreCategory.CONTACT, 8, 15),
                score(ScoreCategory.SKILLS, 20, 30),
                score(ScoreCategory.EXPERIENCE_QUALITY, 15, 25),
                score(ScoreCategory.QUANTIFIED_ACHIEVEMENTS, 10, 20),
                score(ScoreCategory.CONTENT_OPTIMIZATION, 7, 10)));

        assertThat(result.getStrengths()).isEmpty();
        assertThat(result.getWeaknesses()).isEmpty();
    }
}
