package com.raketman.resumeanalyzer.scoring;

import com.raketman.resumeanalyzer.config.AnalyzerTables;
import com.raketman.resumeanalyzer.model.ExperienceEntry;
import com.raketman.resumeanalyzer.model.MetricType;
import com.raketman.resumeanalyzer.model.ScoreCategory;
import com.raketman.resumeanalyzer.model.SectionKind;
import com.raketman.resumeanalyzer.model.SkillCategory;

import java.util.ArrayList;
import java.util.List;

import static com.raketman.resumeanalyzer.model.ScoreCategory.CONTACT;
import static com.raketman.resumeanalyzer.model.ScoreCategory.CONTENT_OPTIMIZATION;
import static com.raketman.resumeanalyzer.model.ScoreCategory.EXPERIENCE_QUALITY;
import static com.raketman.resumeanalyzer.model.ScoreCategory.QUANTIFIED_ACHIEVEMENTS;
import static com.raketman.resumeanalyzer.model.ScoreCategory.SKILLS;

/**
 * The standard rule book. Points given here are defaults; {@code resume.scoring.rule-points}
 * may override them by rule id.
 */
public final class ScoringRules {

    private ScoringRules() {
    }

    public static List<CategoryGate> gates() {
        return List.of(
                CategoryGate.builder()
                        .id("contact-section")
                        .category(CONTACT)
                        .predicate(profile -> profile.hasSectionBody(SectionKind.CONTACT))
                        .reason("no contact section found")
                        .build(),
                CategoryGate.builder()
                        .id("skills-content")
                        .category(SKILLS)
                        .predicate(profile -> profile.hasSectionBody(SectionKind.SKILLS)
                                || profile.hasSectionBody(SectionKind.EXPERIENCE)
                                || profile.hasSectionBody(SectionKind.PROJECTS))
                        .reason("no skills, experience or project section found")
                        .build(),
                CategoryGate.builder()
                        .id("experience-section")
                        .category(EXPERIENCE_QUALITY)
                        .predicate(profile -> profile.hasSectionBody(SectionKind.EXPERIENCE))
                        .reason("no experience section found")
                        .build(),
                CategoryGate.builder()
                        .id("work-history-content")
                        .category(QUANTIFIED_ACHIEVEMENTS)
                        .predicate(profile -> profile.hasSectionBody(SectionKind.EXPERIENCE)
                                || profile.hasSectionBody(SectionKind.PROJECTS))
                        .reason("no experience or project section to draw achievements from")
                        .build()
        );
    }

    public static List<ScoringRule> defaults(AnalyzerTables tables) {
        List<ScoringRule> rules = new ArrayList<>();

        // contact
        rules.add(rule("contact-email", CONTACT, 8)
                .predicate(profile -> profile.getContact().hasEmail())
                .metReason("valid email found")
                .unmetReason("no email address detected")
                .build());
        rules.add(rule("contact-phone", CONTACT, 7)
                .predicate(profile -> profile.getContact().hasPhone())
                .metReason("valid phone number found")
                .unmetReason("no phone number detected")
                .build());

        // skills
        rules.add(rule("skills-section", SKILLS, 4)
                .predicate(profile -> profile.hasSectionBody(SectionKind.SKILLS))
                .metReason("dedicated skills section present")
                .unmetReason("no dedicated skills section")
                .build());
        rules.add(skillCount("skills-count-3", 5, 3));
        rules.add(skillCount("skills-count-6", 5, 6));
        rules.add(skillCount("skills-count-10", 4, 10));
        rules.add(categoryCount("skills-categories-2", 3, 2));
        rules.add(categoryCount("skills-categories-3", 3, 3));
        rules.add(categoryCount("skills-categories-4", 2, 4));
        rules.add(rule("skills-language", SKILLS, 2)
                .predicate(profile -> profile.skillCategories().contains(SkillCategory.LANGUAGE))
                .metReason("programming language listed")
                .unmetReason("no programming language recognized")
                .build());
        rules.add(rule("skills-framework-or-tool", SKILLS, 2)
                .predicate(profile -> profile.skillCategories().contains(SkillCategory.FRAMEWORK)
                        || profile.skillCategories().contains(SkillCategory.TOOL))
                .metReason("frameworks or tools listed")
                .unmetReason("no framework or tool recognized")
                .build());

        // experience quality
        rules.add(rule("experience-titled-entry", EXPERIENCE_QUALITY, 5)
                .predicate(profile -> profile.entriesIn(SectionKind.EXPERIENCE).stream()
                        .anyMatch(ExperienceEntry::hasTitle))
                .metReason("role titles identified")
                .unmetReason("no role title identified")
                .build());
        rules.add(rule("experience-dated-entry", EXPERIENCE_QUALITY, 4)
                .predicate(profile -> profile.entriesIn(SectionKind.EXPERIENCE).stream()
                        .anyMatch(ExperienceEntry::isDated))
                .metReason("employment dates given")
                .unmetReason("no employment date range detected")
                .build());
        rules.add(rule("experience-multiple-entries", EXPERIENCE_QUALITY, 4)
                .metric(profile -> profile.entriesIn(SectionKind.EXPERIENCE).size())
                .predicate(profile -> profile.entriesIn(SectionKind.EXPERIENCE).size() >= 2)
                .metReason("{n} positions described")
                .unmetReason("only {n} position described (2+ expected)")
                .build());
        rules.add(rule("experience-action-verbs", EXPERIENCE_QUALITY, 4)
                .metric(profile -> profile.getActionVerbCount())
                .predicate(profile -> profile.getActionVerbCount() >= 5)
                .metReason("{n} action verbs used")
                .unmetReason("only {n} action verbs used (5+ expected)")
                .noneReason("no action verbs used")
                .build());
        rules.add(rule("experience-detail", EXPERIENCE_QUALITY, 4)
                .metric(profile -> profile.bodyLineCount(SectionKind.EXPERIENCE))
                .predicate(profile -> profile.bodyLineCount(SectionKind.EXPERIENCE) >= 6)
                .metReason("experience described in {n} lines")
                .unmetReason("experience described in only {n} lines (6+ expected)")
                .build());
        rules.add(rule("experience-projects", EXPERIENCE_QUALITY, 4)
                .predicate(profile -> profile.hasSectionBody(SectionKind.PROJECTS))
                .metReason("projects section present")
                .unmetReason("no projects section")
                .build());

        // quantified achievements
        rules.add(claimCount("quantified-any", 6, 1));
        rules.add(claimCount("quantified-3", 5, 3));
        rules.add(claimCount("quantified-5", 4, 5));
        rules.add(rule("quantified-metric-variety", QUANTIFIED_ACHIEVEMENTS, 3)
                .metric(profile -> profile.metricTypes().size())
                .predicate(profile -> profile.metricTypes().size() >= 2)
                .metReason("{n} kinds of metrics used")
                .unmetReason("only {n} kind of metric used")
                .noneReason("no metrics used")
                .build());
        rules.add(rule("quantified-business-impact", QUANTIFIED_ACHIEVEMENTS, 2)
                .predicate(profile -> profile.metricTypes().contains(MetricType.PERCENT)
                        || profile.metricTypes().contains(MetricType.CURRENCY))
                .metReason("percentage or monetary impact stated")
                .unmetReason("no percentage or monetary impact stated")
                .build());

        // content optimization
        rules.add(rule("content-headings", CONTENT_OPTIMIZATION, 3)
                .metric(profile -> profile.getHeadingCount())
                .predicate(profile -> profile.getHeadingCount() >= 3)
                .metReason("{n} standard section headings")
                .unmetReason("only {n} section headings detected (3+ expected)")
                .noneReason("no section headings detected")
                .build());
        int minWords = tables.getWordCountMin();
        int maxWords = tables.getWordCountMax();
        rules.add(rule("content-length", CONTENT_OPTIMIZATION, 2)
                .metric(profile -> profile.getWordCount())
                .predicate(profile -> profile.getWordCount() >= minWords && profile.getWordCount() <= maxWords)
                .metReason("{n} words, within the " + minWords + "-" + maxWords + " range")
                .unmetReason("{n} words, outside the " + minWords + "-" + maxWords + " range")
                .build());
        rules.add(sectionPresent("content-education", 2, SectionKind.EDUCATION, "education"));
        rules.add(sectionPresent("content-summary", 1, SectionKind.SUMMARY, "summary"));
        rules.add(sectionPresent("content-certifications", 1, SectionKind.CERTIFICATIONS, "certifications"));
        rules.add(rule("content-bullets", CONTENT_OPTIMIZATION, 1)
                .metric(profile -> profile.getBulletLineCount())
                .predicate(profile -> profile.getBulletLineCount() >= 8)
                .metReason("{n} bullet points")
                .unmetReason("only {n} bullet points (8+ expected)")
                .noneReason("no bullet points used")
                .build());

        return rules;
    }

    private static ScoringRule.ScoringRuleBuilder rule(String id, ScoreCategory category, int points) {
        return ScoringRule.builder().id(id).category(category).points(points);
    }

    private static ScoringRule skillCount(String id, int points, int threshold) {
        return rule(id, SKILLS, points)
                .metric(profile -> profile.getSkills().size())
                .predicate(profile -> profile.getSkills().size() >= threshold)
                .metReason("{n} recognized skills (" + threshold + "+)")
                .unmetReason("{n} recognized skills, fewer than " + threshold)
                .noneReason("no recognized skills")
                .build();
    }

    private static ScoringRule categoryCount(String id, int points, int threshold) {
        return rule(id, SKILLS, points)
                .metric(profile -> profile.skillCategories().size())
                .predicate(profile -> profile.skillCategories().size() >= threshold)
                .metReason("skills span {n} categories (" + threshold + "+)")
                .unmetReason("skills span {n} categories, fewer than " + threshold)
                .noneReason("no skill categories covered")
                .build();
    }

    private static ScoringRule claimCount(String id, int points, int threshold) {
        return rule(id, QUANTIFIED_ACHIEVEMENTS, points)
                .metric(profile -> profile.getClaims().size())
                .predicate(profile -> profile.getClaims().size() >= threshold)
                .metReason("{n} quantified achievements (" + threshold + "+)")
                .unmetReason("{n} quantified achievements, fewer than " + threshold)
                .noneReason("no quantified achievements found")
                .build();
    }

    private static ScoringRule sectionPresent(String id, int points, SectionKind kind, String label) {
        return rule(id, CONTENT_OPTIMIZATION, points)
                .predicate(profile -> profile.hasSectionBody(kind))
                .metReason(label + " section present")
                .unmetReason("no " + label + " section")
                .build();
    }
}
