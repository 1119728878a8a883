package com.raketman.resumeanalyzer.service;

import com.raketman.resumeanalyzer.model.ContactInfo;
import com.raketman.resumeanalyzer.model.ExperienceLevel;
import com.raketman.resumeanalyzer.model.FitLevel;
import com.raketman.resumeanalyzer.model.MatchConfidence;
import com.raketman.resumeanalyzer.model.RequiredSkill;
import com.raketman.resumeanalyzer.model.ResumeProfile;
import com.raketman.resumeanalyzer.model.RoleMatchResult;
import com.raketman.resumeanalyzer.model.RoleProfile;
import com.raketman.resumeanalyzer.model.SeniorityFit;
import com.raketman.resumeanalyzer.model.SkillCategory;
import com.raketman.resumeanalyzer.model.SkillToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RoleMatcherTest {

    private final RoleMatcher matcher = new RoleMatcher();

    private static ResumeProfile profileWith(ExperienceLevel level, SkillToken... skills) {
        return ResumeProfile.builder()
                .contact(ContactInfo.empty())
                .skills(List.of(skills))
                .claims(List.of())
                .experiences(List.of())
                .sectionCoverage(Map.of())
                .experienceLevel(level)
                .build();
    }

    private static SkillToken skill(String id, MatchConfidence confidence) {
        return SkillToken.builder()
                .id(id)
                .name(id.toUpperCase())
                .rawText(id)
                .category(SkillCategory.TOOL)
                .confidence(confidence)
                .build();
    }

    private static RoleProfile role(String name, ExperienceLevel level, Object... idsAndWeights) {
        List<RequiredSkill> required = new ArrayList<>();
        for (int i = 0; i < idsAndWeights.length; i += 2) {
            String id = (String) idsAndWeights[i];
            required.add(RequiredSkill.builder()
                    .skillId(id)
                    .name(id.toUpperCase())
                    .weight((Integer) idsAndWeights[i + 1])
                    .build());
        }
        return RoleProfile.builder().name(name).experienceLevel(level).requiredSkills(required).build();
    }

    @Test
    @DisplayName("missing skills subtract their weights and are listed heaviest first")
    void missingSkillsPenalized() {
        RoleProfile role = role("Sample", ExperienceLevel.MID, "a", 5, "b", 3, "c", 2);

        RoleMatchResult result = matcher.match(profileWith(ExperienceLevel.MID, skill("b", MatchConfidence.EXACT)), role);

        assertThat(result.getCompatibility()).isEqualTo(93);
        assertThat(result.getMissingSkills()).extracting(RequiredSkill::getSkillId).containsExactly("a", "c");
        assertThat(result.getMatchedSkills()).extracting(RequiredSkill::getSkillId).containsExactly("b");
        assertThat(result.getFitLevel()).isEqualTo(FitLevel.STRONG);
        assertThat(result.getSeniorityFit()).isEqualTo(SeniorityFit.MEETS);
    }

    @Test
    @DisplayName("compatibility never drops below zero")
    void flooredAtZero() {
        RoleProfile role = role("Heavy", ExperienceLevel.SENIOR, "a", 60, "b", 50);

        RoleMatchResult result = matcher.match(profileWith(ExperienceLevel.ENTRY), role);

        assertThat(result.getCompatibility()).isZero();
        assertThat(result.getFitLevel()).isEqualTo(FitLevel.POOR);
        assertThat(result.getSeniorityFit()).isEqualTo(SeniorityFit.BELOW);
    }

    @Test
    @DisplayName("equal weights keep the role's declared order")
    void stableOrderForEqualWeights() {
        RoleProfile role = role("Even", ExperienceLevel.UNKNOWN, "x", 10, "y", 10, "z", 10);

        RoleMatchResult result = matcher.match(profileWith(ExperienceLevel.UNKNOWN), role);

        assertThat(result.getMissingSkills()).extracting(RequiredSkill::getSkillId).containsExactly("x", "y", "z");
        assertThat(result.getCompatibility()).isEqualTo(70);
        assertThat(result.getSeniorityFit()).isEqualTo(SeniorityFit.UNKNOWN);
    }

    @Test
    @DisplayName("fuzzy-only matches count as matched but are flagged weak")
    void fuzzyMatchesAreWeak() {
        RoleProfile role = role("Ops", ExperienceLevel.MID, "kubernetes", 20, "docker", 20);

        RoleMatchResult result = matcher.match(profileWith(ExperienceLevel.SENIOR,
                skill("kubernetes", MatchConfidence.FUZZY), skill("docker", MatchConfidence.EXACT)), role);

        assertThat(result.getCompatibility()).isEqualTo(100);
        assertThat(result.getWeakSkills()).extracting(RequiredSkill::getSkillId).containsExactly("kubernetes");
        assertThat(result.getSeniorityFit()).isEqualTo(SeniorityFit.ABOVE);
    }

    @Test
    @DisplayName("roles are ranked by compatibility, ties in declared order")
    void rankedRoles() {
        ResumeProfile profile = profileWith(ExperienceLevel.MID, skill("a", MatchConfidence.EXACT));
        List<RoleProfile> roles = List.of(
                role("First", ExperienceLevel.MID, "b", 40),
                role("Second", ExperienceLevel.MID, "a", 40),
                role("Third", ExperienceLevel.MID, "c", 40));

        List<RoleMatchResult> results = matcher.matchAll(profile, roles);

        assertThat(results).extracting(RoleMatchResult::getRoleName).containsExactly("Second", "First", "Third");
        assertThat(results).extracting(RoleMatchResult::getFitLevel)
                .containsExactly(FitLevel.STRONG, FitLevel.GOOD, FitLevel.GOOD);
    }
}
