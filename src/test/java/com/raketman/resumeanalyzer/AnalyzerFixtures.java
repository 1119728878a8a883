package com.raketman.resumeanalyzer;

import com.raketman.resumeanalyzer.ai.AbsentNarrativeGenerator;
import com.raketman.resumeanalyzer.ai.AiInsightService;
import com.raketman.resumeanalyzer.config.AnalyzerProperties;
import com.raketman.resumeanalyzer.config.AnalyzerTables;
import com.raketman.resumeanalyzer.service.AggregateScorer;
import com.raketman.resumeanalyzer.service.CategoryScorer;
import com.raketman.resumeanalyzer.service.EntityExtractor;
import com.raketman.resumeanalyzer.service.QuantificationDetector;
import com.raketman.resumeanalyzer.service.ResumeAnalysisService;
import com.raketman.resumeanalyzer.service.ResumeContentValidator;
import com.raketman.resumeanalyzer.service.RoleMatcher;
import com.raketman.resumeanalyzer.service.SectionSegmenter;
import com.raketman.resumeanalyzer.service.StrengthWeaknessAnalyzer;
import com.raketman.resumeanalyzer.service.TextNormalizer;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Pipeline components wired by hand from the shipped application.yml, with a fixed clock.
 */
public final class AnalyzerFixtures {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-15T10:00:00Z"), ZoneOffset.UTC);

    public static final String STRONG_RESUME = String.join("\n",
            "Jane Doe",
            "jane.doe@example.com | +1 415 555 0134 | San Francisco, CA",
            "",
            "PROFESSIONAL SUMMARY",
            "Backend engineer with seven years of experience building Java services for fintech platforms.",
            "",
            "TECHNICAL SKILLS",
            "Languages: Java, Python, SQL, JavaScript",
            "Frameworks: Spring Boot, React, Hibernate",
            "Tools: Docker, Kubernetes, AWS, Git, Jenkins, PostgreSQL",
            "Practices: Microservices, REST APIs, CI/CD, Agile",
            "",
            "WORK EXPERIENCE",
            "Senior Software Engineer, Acme Corp | Jan 2021 – Present",
            "• Led migration of 12 services to Kubernetes, cutting deployment time by 40%",
            "• Designed payment APIs processing $2M in daily transactions",
            "• Mentored a team of 5 engineers and improved code review turnaround",
            "• Reduced infrastructure cost by 25% through autoscaling",
            "Software Engineer, Globex | Jun 2017 - Dec 2020",
            "• Built reporting services used by 10,000 users",
            "• Optimized SQL queries, reducing report latency from 9 seconds to 2 seconds",
            "• Automated release pipelines, increasing release frequency 3x",
            "",
            "PROJECTS",
            "Open source rate limiter library for Spring Boot with 500 GitHub stars",
            "",
            "EDUCATION",
            "B.Sc. Computer Science, State University, 2017",
            "",
            "CERTIFICATIONS",
            "AWS Certified Solutions Architect");

    public static final String UNSTRUCTURED_RESUME = String.join("\n",
            "i have been writing software for a while and enjoy working with people on hard problems",
            "most of my time went into maintaining internal tools and fixing whatever broke during the week",
            "looking for a place where i can keep learning and contribute to a friendly engineering team");

    private AnalyzerFixtures() {
    }

    public static AnalyzerProperties properties() {
        try {
            List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                    .load("application", new ClassPathResource("application.yml"));
            return new Binder(ConfigurationPropertySources.from(sources))
                    .bind("resume", AnalyzerProperties.class)
                    .get();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static AnalyzerTables tables() {
        return AnalyzerTables.from(properties());
    }

    public static EntityExtractor entityExtractor(AnalyzerTables tables) {
        return new EntityExtractor(tables, CLOCK, new QuantificationDetector());
    }

    public static ResumeAnalysisService analysisService() {
        return analysisService(new AiInsightService(new AbsentNarrativeGenerator(), Runnable::run));
    }

    public static ResumeAnalysisService analysisService(AiInsightService aiInsightService) {
        AnalyzerProperties properties = properties();
        AnalyzerTables tables = AnalyzerTables.from(properties);
        return new ResumeAnalysisService(
                tables,
                new TextNormalizer(),
                new SectionSegmenter(tables),
                entityExtractor(tables),
                new CategoryScorer(tables),
                new AggregateScorer(tables),
                new RoleMatcher(),
                new StrengthWeaknessAnalyzer(tables),
                new ResumeContentValidator(properties),
                aiInsightService,
                properties);
    }
}
