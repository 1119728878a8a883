package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structured view of one resume. The section coverage map holds, for every section kind
 * present in the document, the number of body lines across all sections of that kind.
 */
@Value
@Builder
public class ResumeProfile {

    ContactInfo contact;
    List<SkillToken> skills;
    List<QuantifiedClaim> claims;
    List<ExperienceEntry> experiences;
    Map<SectionKind, Integer> sectionCoverage;
    int headingCount;
    int wordCount;
    int actionVerbCount;
    int bulletLineCount;
    int totalExperienceMonths;
    ExperienceLevel experienceLevel;

    public boolean hasSectionBody(SectionKind kind) {
        return bodyLineCount(kind) > 0;
    }

    public int bodyLineCount(SectionKind kind) {
        return sectionCoverage.getOrDefault(kind, 0);
    }

    public Set<SkillCategory> skillCategories() {
        return skills.stream()
                .map(SkillToken::getCategory)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(SkillCategory.class)));
    }

    public Set<MetricType> metricTypes() {
        return claims.stream()
                .map(QuantifiedClaim::getMetricType)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(MetricType.class)));
    }

    public List<ExperienceEntry> entriesIn(SectionKind kind) {
        return experiences.stream()
                .filter(entry -> entry.getSectionKind() == kind)
                .collect(Collectors.toList());
    }
}
