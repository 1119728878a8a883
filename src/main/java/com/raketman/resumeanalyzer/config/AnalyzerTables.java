package com.raketman.resumeanalyzer.config;

import com.raketman.resumeanalyzer.exception.InvalidConfigurationException;
import com.raketman.resumeanalyzer.model.ExperienceLevel;
import com.raketman.resumeanalyzer.model.GradeTier;
import com.raketman.resumeanalyzer.model.RequiredSkill;
import com.raketman.resumeanalyzer.model.RoleProfile;
import com.raketman.resumeanalyzer.model.ScoreCategory;
import com.raketman.resumeanalyzer.model.SectionKind;
import com.raketman.resumeanalyzer.model.SkillDefinition;
import com.raketman.resumeanalyzer.util.Terms;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable, validated snapshot of the analyzer configuration. Built once at startup and
 * handed to every pipeline component; any inconsistency fails the build with an
 * {@link InvalidConfigurationException}.
 */
@Value
@Builder(access = AccessLevel.PRIVATE)
public class AnalyzerTables {

    int minCharacters;
    int minWords;
    int maxHeadingLength;
    int maxHeadingWords;
    int maxContactLines;

    List<HeadingSynonyms> headings;
    Set<String> connectorWords;

    Map<String, SkillDefinition> skills;
    int fuzzyThreshold;
    int fuzzyMinLength;

    Set<String> actionVerbs;

    Map<ScoreCategory, Integer> categoryMax;
    Map<String, Integer> rulePoints;
    List<GradeTier> gradeTiers;
    double strengthRatio;
    double weaknessRatio;
    double criticalRatio;
    int wordCountMin;
    int wordCountMax;

    List<RoleProfile> roles;

    /**
     * Synonym phrases, normalized, that identify headings of one section kind.
     */
    @Value
    public static class HeadingSynonyms {
        SectionKind kind;
        List<String> phrases;
    }

    public int maxPoints(ScoreCategory category) {
        return categoryMax.get(category);
    }

    public Optional<RoleProfile> findRole(String name) {
        return roles.stream()
                .filter(role -> role.getName().equalsIgnoreCase(name.trim()))
                .findFirst();
    }

    public static AnalyzerTables from(AnalyzerProperties properties) {
        AnalyzerProperties.Content content = properties.getContent();
        require(content.getMinCharacters() > 0, "resume.content.min-characters must be positive");
        require(content.getMinWords() > 0, "resume.content.min-words must be positive");
        require(content.getMaxHeadingLength() > 0, "resume.content.max-heading-length must be positive");
        require(content.getMaxHeadingWords() > 0, "resume.content.max-heading-words must be positive");
        require(content.getMaxContactLines() > 0, "resume.content.max-contact-lines must be positive");

        Map<String, SkillDefinition> skills = buildTaxonomy(properties.getSkills());
        AnalyzerProperties.Scoring scoring = properties.getScoring();

        require(scoring.getWeaknessRatio() > 0 && scoring.getWeaknessRatio() < scoring.getStrengthRatio()
                        && scoring.getStrengthRatio() <= 1.0,
                "resume.scoring ratios must satisfy 0 < weakness-ratio < strength-ratio <= 1");
        require(scoring.getCriticalRatio() >= 0 && scoring.getCriticalRatio() <= scoring.getWeaknessRatio(),
                "resume.scoring.critical-ratio must lie between 0 and weakness-ratio");
        require(scoring.getWordCountMin() > 0 && scoring.getWordCountMin() <= scoring.getWordCountMax(),
                "resume.scoring.word-count-min must be positive and not above word-count-max");

        scoring.getRulePoints().forEach((ruleId, points) ->
                require(points != null && points > 0, "Rule points for '" + ruleId + "' must be positive"));

        return AnalyzerTables.builder()
                .minCharacters(content.getMinCharacters())
                .minWords(content.getMinWords())
                .maxHeadingLength(content.getMaxHeadingLength())
                .maxHeadingWords(content.getMaxHeadingWords())
                .maxContactLines(content.getMaxContactLines())
                .headings(buildHeadings(properties.getSections()))
                .connectorWords(Collections.unmodifiableSet(properties.getConnectorWords().stream()
                        .map(Terms::normalizeHeading)
                        .filter(word -> !word.isEmpty())
                        .collect(Collectors.<String, Set<String>>toCollection(LinkedHashSet::new))))
                .skills(skills)
                .fuzzyThreshold(requireRange(properties.getSkills().getFuzzyThreshold(), 1, 100,
                        "resume.skills.fuzzy-threshold"))
                .fuzzyMinLength(Math.max(1, properties.getSkills().getFuzzyMinLength()))
                .actionVerbs(Collections.unmodifiableSet(properties.getActionVerbs().stream()
                        .map(verb -> verb.trim().toLowerCase(Locale.ROOT))
                        .filter(verb -> !verb.isEmpty())
                        .collect(Collectors.<String, Set<String>>toCollection(LinkedHashSet::new))))
                .categoryMax(buildCategoryMax(scoring.getCategoryMax()))
                .rulePoints(Collections.unmodifiableMap(new LinkedHashMap<>(scoring.getRulePoints())))
                .gradeTiers(buildGradeTiers(scoring.getGradeTiers()))
                .strengthRatio(scoring.getStrengthRatio())
                .weaknessRatio(scoring.getWeaknessRatio())
                .criticalRatio(scoring.getCriticalRatio())
                .wordCountMin(scoring.getWordCountMin())
                .wordCountMax(scoring.getWordCountMax())
                .roles(buildRoles(properties.getRoles(), skills))
                .build();
    }

    private static List<HeadingSynonyms> buildHeadings(List<AnalyzerProperties.SectionHeading> sections) {
        require(!sections.isEmpty(), "resume.sections must declare at least one section heading table");
        List<HeadingSynonyms> headings = new ArrayList<>();
        for (AnalyzerProperties.SectionHeading section : sections) {
            require(section.getKind() != null, "resume.sections entries must name a section kind");
            require(section.getKind() != SectionKind.OTHER, "OTHER is the catch-all kind and cannot have headings");
            List<String> phrases = section.getSynonyms().stream()
                    .map(Terms::normalizeHeading)
                    .filter(phrase -> !phrase.isEmpty())
                    .distinct()
                    .collect(Collectors.toList());
            require(!phrases.isEmpty(), "Section kind " + section.getKind() + " has no usable heading synonyms");
            headings.add(new HeadingSynonyms(section.getKind(), List.copyOf(phrases)));
        }
        return List.copyOf(headings);
    }

    private static Map<String, SkillDefinition> buildTaxonomy(AnalyzerProperties.Skills config) {
        require(!config.getTaxonomy().isEmpty(), "resume.skills.taxonomy must not be empty");
        Map<String, SkillDefinition> taxonomy = new LinkedHashMap<>();
        config.getTaxonomy().forEach((id, skill) -> {
            require(skill.getName() != null && !skill.getName().isBlank(), "Skill '" + id + "' has no name");
            require(skill.getCategory() != null, "Skill '" + id + "' has no category");
            List<String> aliases = new ArrayList<>(skill.getAliases());
            aliases.add(skill.getName());
            List<String> normalized = aliases.stream()
                    .map(Terms::normalizeSkillText)
                    .filter(alias -> !alias.isEmpty())
                    .distinct()
                    .collect(Collectors.toList());
            require(!normalized.isEmpty(), "Skill '" + id + "' has no usable aliases");
            taxonomy.put(id, SkillDefinition.builder()
                    .id(id)
                    .name(skill.getName())
                    .category(skill.getCategory())
                    .aliases(List.copyOf(normalized))
                    .build());
        });
        return Collections.unmodifiableMap(taxonomy);
    }

    private static Map<ScoreCategory, Integer> buildCategoryMax(Map<String, Integer> configured) {
        Map<ScoreCategory, Integer> maxima = new EnumMap<>(ScoreCategory.class);
        configured.forEach((key, points) -> {
            ScoreCategory category = parseCategory(key);
            require(points != null && points > 0, "Maximum points for " + category + " must be positive");
            maxima.put(category, points);
        });
        for (ScoreCategory category : ScoreCategory.values()) {
            require(maxima.containsKey(category), "resume.scoring.category-max is missing " + category);
        }
        int sum = maxima.values().stream().mapToInt(Integer::intValue).sum();
        require(sum == 100, "resume.scoring.category-max must sum to 100 but sums to " + sum);
        return Collections.unmodifiableMap(maxima);
    }

    private static ScoreCategory parseCategory(String key) {
        String constant = key.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return ScoreCategory.valueOf(constant);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Unknown score category '" + key + "'");
        }
    }

    private static List<GradeTier> buildGradeTiers(List<AnalyzerProperties.Grade> grades) {
        require(!grades.isEmpty(), "resume.scoring.grade-tiers must not be empty");
        Set<Integer> bounds = new HashSet<>();
        List<GradeTier> tiers = new ArrayList<>();
        for (AnalyzerProperties.Grade grade : grades) {
            require(grade.getName() != null && !grade.getName().isBlank(), "Grade tiers must be named");
            requireRange(grade.getMinPoints(), 0, 100, "Grade tier '" + grade.getName() + "' min-points");
            require(bounds.add(grade.getMinPoints()),
                    "Grade tiers overlap at " + grade.getMinPoints() + " points");
            tiers.add(GradeTier.builder().name(grade.getName()).minPoints(grade.getMinPoints()).build());
        }
        require(bounds.contains(0), "The lowest grade tier must start at 0 points");
        tiers.sort(Comparator.comparingInt(GradeTier::getMinPoints).reversed());
        return List.copyOf(tiers);
    }

    private static List<RoleProfile> buildRoles(List<AnalyzerProperties.Role> roles,
                                                Map<String, SkillDefinition> skills) {
        Set<String> names = new HashSet<>();
        List<RoleProfile> profiles = new ArrayList<>();
        for (AnalyzerProperties.Role role : roles) {
            require(role.getName() != null && !role.getName().isBlank(), "Role profiles must be named");
            require(names.add(role.getName().toLowerCase(Locale.ROOT)), "Duplicate role '" + role.getName() + "'");
            require(!role.getRequiredSkills().isEmpty(), "Role '" + role.getName() + "' requires no skills");

            Set<String> seen = new HashSet<>();
            List<RequiredSkill> required = new ArrayList<>();
            for (AnalyzerProperties.RoleSkill roleSkill : role.getRequiredSkills()) {
                SkillDefinition skill = skills.get(roleSkill.getSkill());
                require(skill != null,
                        "Role '" + role.getName() + "' requires unknown skill '" + roleSkill.getSkill() + "'");
                require(roleSkill.getWeight() > 0,
                        "Role '" + role.getName() + "' weight for '" + roleSkill.getSkill() + "' must be positive");
                require(seen.add(skill.getId()),
                        "Role '" + role.getName() + "' lists '" + skill.getId() + "' twice");
                required.add(RequiredSkill.builder()
                        .skillId(skill.getId())
                        .name(skill.getName())
                        .weight(roleSkill.getWeight())
                        .build());
            }
            profiles.add(RoleProfile.builder()
                    .name(role.getName())
                    .description(role.getDescription())
                    .experienceLevel(role.getExperienceLevel() != null ? role.getExperienceLevel() : ExperienceLevel.UNKNOWN)
                    .requiredSkills(List.copyOf(required))
                    .build());
        }
        return List.copyOf(profiles);
    }

    private static int requireRange(int value, int min, int max, String name) {
        require(value >= min && value <= max, name + " must be between " + min + " and " + max);
        return value;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new InvalidConfigurationException(message);
        }
    }
}
