package com.raketman.resumeanalyzer.ai;

import com.raketman.resumeanalyzer.model.CategoryScore;
import com.raketman.resumeanalyzer.model.ExperienceEntry;
import com.raketman.resumeanalyzer.model.QuantifiedClaim;
import com.raketman.resumeanalyzer.model.ResumeProfile;
import com.raketman.resumeanalyzer.model.ScoreReport;
import com.raketman.resumeanalyzer.model.SkillToken;
import com.raketman.resumeanalyzer.model.Weakness;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds narrative prompts from structured analysis output only. Raw resume text never leaves
 * the service.
 */
@Component
public class NarrativePrompts {

    private static final int MAX_CLAIMS = 10;
    private static final int MAX_ENTRIES = 8;
    private static final int MAX_WEAKNESSES = 5;

    private static final String SCORE_GUARD =
            "Never contradict the numeric scores you are given; explain and build on them.";

    public SystemMessage systemMessage(String targetRole) {
        if (targetRole == null || targetRole.isBlank()) {
            return new SystemMessage("You are a senior technical recruiter and career consultant with deep "
                    + "experience in resume optimization, ATS systems and technical hiring.\n"
                    + "Provide specific, actionable feedback and avoid generic advice. Be direct about "
                    + "weaknesses while staying constructive.\n"
                    + SCORE_GUARD);
        }
        return new SystemMessage(String.format("You are a technical hiring manager for %1$s positions who knows "
                + "the current technology stacks, expectations and career paths for %1$s roles.\n"
                + "Give technical feedback tailored to %1$s candidates and be specific about skill gaps "
                + "and market positioning.\n", targetRole)
                + SCORE_GUARD);
    }

    public UserMessage userMessage(ResumeProfile profile, ScoreReport report, String targetRole) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Write an analysis of this resume from the structured data below.\n\n");

        prompt.append("SCORE: ").append(report.getTotalPoints()).append("/100 (")
                .append(report.getGrade().getName()).append(")\n");
        for (CategoryScore score : report.getCategories()) {
            prompt.append("- ").append(score.getCategory().getDisplayName()).append(": ")
                    .append(score.getPointsEarned()).append('/').append(score.getMaxPoints()).append('\n');
            score.getReasons().forEach(reason -> prompt.append("    ").append(reason).append('\n'));
        }

        prompt.append("\nSKILLS: ").append(profile.getSkills().isEmpty() ? "none recognized"
                : profile.getSkills().stream()
                .map(skill -> skill.getName() + " (" + skill.getCategory() + ")")
                .collect(Collectors.joining(", ")));

        prompt.append("\nEXPERIENCE LEVEL: ").append(profile.getExperienceLevel())
                .append(", ").append(profile.getTotalExperienceMonths()).append(" months\n");
        profile.getExperiences().stream()
                .limit(MAX_ENTRIES)
                .filter(ExperienceEntry::hasTitle)
                .forEach(entry -> prompt.append("- ").append(entry.getTitle()).append('\n'));

        prompt.append("\nQUANTIFIED ACHIEVEMENTS:\n");
        profile.getClaims().stream()
                .limit(MAX_CLAIMS)
                .map(QuantifiedClaim::getText)
                .forEach(text -> prompt.append("- ").append(text).append('\n'));

        if (targetRole != null && !targetRole.isBlank()) {
            prompt.append("\nTARGET ROLE: ").append(targetRole).append('\n');
        }

        prompt.append("\nStructure the answer as:\n")
                .append("## EXECUTIVE SUMMARY\n")
                .append("## TECHNICAL COMPETENCY ANALYSIS\n")
                .append("## ATS OPTIMIZATION EVALUATION\n")
                .append("## PRIORITY ACTION PLAN (top 3 immediate improvements, then medium-term priorities)\n");
        return new UserMessage(prompt.toString());
    }

    public SystemMessage improvementSystemMessage() {
        return new SystemMessage("You are an expert career coach specializing in resume optimization and "
                + "professional development. Provide specific, actionable improvement recommendations.\n"
                + SCORE_GUARD);
    }

    /**
     * Improvement request built from the weakest categories, at most five, in the order given.
     */
    public UserMessage improvementUserMessage(ResumeProfile profile, List<Weakness> weaknesses, String targetRole) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Based on this resume analysis and the weaknesses identified, provide a comprehensive "
                + "improvement action plan.\n\n");

        prompt.append("KEY WEAKNESSES IDENTIFIED:\n");
        if (weaknesses.isEmpty()) {
            prompt.append("- none below the weakness threshold; focus on polishing the strongest material\n");
        }
        weaknesses.stream()
                .limit(MAX_WEAKNESSES)
                .forEach(weakness -> {
                    prompt.append("- [").append(weakness.getPriority()).append("] ")
                            .append(weakness.getStatement()).append('\n');
                    weakness.getDetails().forEach(detail -> prompt.append("    ").append(detail).append('\n'));
                });

        prompt.append("\nSKILLS: ").append(profile.getSkills().isEmpty() ? "none recognized"
                : profile.getSkills().stream()
                .map(SkillToken::getName)
                .collect(Collectors.joining(", ")));
        prompt.append("\nEXPERIENCE LEVEL: ").append(profile.getExperienceLevel()).append('\n');
        if (targetRole != null && !targetRole.isBlank()) {
            prompt.append("TARGET ROLE: ").append(targetRole).append('\n');
        }

        prompt.append("\nStructure the answer as:\n")
                .append("## IMMEDIATE CRITICAL FIXES (next 1-2 weeks)\n")
                .append("## CONTENT ENHANCEMENT STRATEGY (next 1-2 months)\n")
                .append("## LONG-TERM PROFESSIONAL DEVELOPMENT (3-6 months)\n")
                .append("## SPECIFIC LANGUAGE IMPROVEMENTS\n")
                .append("For each recommendation say why it matters, how to implement it and what impact it "
                        + "will have. Give exact phrases and keywords where possible.\n");
        return new UserMessage(prompt.toString());
    }
}
