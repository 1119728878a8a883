package com.raketman.resumeanalyzer.config;

import com.raketman.resumeanalyzer.model.ExperienceLevel;
import com.raketman.resumeanalyzer.model.SectionKind;
import com.raketman.resumeanalyzer.model.SkillCategory;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw, mutable binding of the {@code resume.*} tables. Components never read this directly;
 * they receive the validated {@link AnalyzerTables} snapshot.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "resume")
public class AnalyzerProperties {

    private Content content = new Content();
    private List<SectionHeading> sections = new ArrayList<>();
    private List<String> connectorWords = new ArrayList<>();
    private Skills skills = new Skills();
    private List<String> actionVerbs = new ArrayList<>();
    private Scoring scoring = new Scoring();
    private List<Role> roles = new ArrayList<>();
    private Ai ai = new Ai();
    private Executor executor = new Executor();

    @Getter
    @Setter
    public static class Content {
        private int minCharacters = 100;
        private int minWords = 30;
        private long maxFileSizeBytes = 10L * 1024 * 1024;
        private List<String> supportedFormats = new ArrayList<>(List.of("pdf", "docx", "doc", "txt", "rtf"));
        private double readableRatio = 0.6;
        private int maxHeadingLength = 40;
        private int maxHeadingWords = 5;
        private int maxContactLines = 6;
        private List<String> resumeIndicators = new ArrayList<>();
        private int minResumeIndicators = 3;
        private int advisoryMinWords = 200;
        private int advisoryMaxWords = 2000;
    }

    @Getter
    @Setter
    public static class SectionHeading {
        private SectionKind kind;
        private List<String> synonyms = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Skills {
        private int fuzzyThreshold = 90;
        private int fuzzyMinLength = 4;
        private Map<String, Skill> taxonomy = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Skill {
        private String name;
        private SkillCategory category;
        private List<String> aliases = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Scoring {
        private Map<String, Integer> categoryMax = new LinkedHashMap<>();
        private Map<String, Integer> rulePoints = new LinkedHashMap<>();
        private List<Grade> gradeTiers = new ArrayList<>();
        private double strengthRatio = 0.8;
        private double weaknessRatio = 0.5;
        private double criticalRatio = 0.25;
        private int wordCountMin = 200;
        private int wordCountMax = 1000;
    }

    @Getter
    @Setter
    public static class Grade {
        private String name;
        private int minPoints;
    }

    @Getter
    @Setter
    public static class Role {
        private String name;
        private String description;
        private ExperienceLevel experienceLevel = ExperienceLevel.UNKNOWN;
        private List<RoleSkill> requiredSkills = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class RoleSkill {
        private String skill;
        private int weight;
    }

    @Getter
    @Setter
    public static class Ai {
        private boolean enabled = false;
        private String apiKey;
        private String baseUrl = "https://api.openai.com";
        private String model = "gpt-3.5-turbo";
        private double temperature = 0.4;
        private int maxTokens = 1200;
        private long timeoutMs = 20000;
        private Cost cost = new Cost();
    }

    @Getter
    @Setter
    public static class Cost {
        private int charactersPerToken = 4;
        private int promptTokens = 1000;
        private int responseTokens = 1500;
        private double usdPer1kTokens = 0.002;
        private double roleSpecificFactor = 1.5;
    }

    @Getter
    @Setter
    public static class Executor {
        private int analysisPoolSize = 4;
        private int analysisQueueCapacity = 100;
        private int aiPoolSize = 2;
        private int aiQueueCapacity = 20;
    }
}
