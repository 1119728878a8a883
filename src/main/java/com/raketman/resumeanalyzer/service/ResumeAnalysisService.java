package com.raketman.resumeanalyzer.service;

import com.raketman.resumeanalyzer.ai.AiInsightService;
import com.raketman.resumeanalyzer.config.AnalyzerProperties;
import com.raketman.resumeanalyzer.config.AnalyzerTables;
import com.raketman.resumeanalyzer.exception.UnknownRoleException;
import com.raketman.resumeanalyzer.model.AiInsight;
import com.raketman.resumeanalyzer.model.AnalysisReport;
import com.raketman.resumeanalyzer.model.AnalysisResult;
import com.raketman.resumeanalyzer.model.CategoryScore;
import com.raketman.resumeanalyzer.model.ContentValidation;
import com.raketman.resumeanalyzer.model.RawDocument;
import com.raketman.resumeanalyzer.model.ResumeProfile;
import com.raketman.resumeanalyzer.model.RoleMatchResult;
import com.raketman.resumeanalyzer.model.RoleProfile;
import com.raketman.resumeanalyzer.model.ScoreReport;
import com.raketman.resumeanalyzer.model.Section;
import com.raketman.resumeanalyzer.model.SparseContent;
import com.raketman.resumeanalyzer.model.StrengthWeaknessReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the full analysis for one resume: normalize, segment, extract, score, then role fit and
 * strength/weakness judgments, with an optional AI narrative and improvement plan on top.
 */
@Service
public class ResumeAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(ResumeAnalysisService.class);

    private final AnalyzerTables tables;
    private final TextNormalizer textNormalizer;
    private final SectionSegmenter sectionSegmenter;
    private final EntityExtractor entityExtractor;
    private final CategoryScorer categoryScorer;
    private final AggregateScorer aggregateScorer;
    private final RoleMatcher roleMatcher;
    private final StrengthWeaknessAnalyzer strengthWeaknessAnalyzer;
    private final ResumeContentValidator contentValidator;
    private final AiInsightService aiInsightService;
    private final Duration defaultAiTimeout;

    public ResumeAnalysisService(AnalyzerTables tables,
                                 TextNormalizer textNormalizer,
                                 SectionSegmenter sectionSegmenter,
                                 EntityExtractor entityExtractor,
                                 CategoryScorer categoryScorer,
                                 AggregateScorer aggregateScorer,
                                 RoleMatcher roleMatcher,
                                 StrengthWeaknessAnalyzer strengthWeaknessAnalyzer,
                                 ResumeContentValidator contentValidator,
                                 AiInsightService aiInsightService,
                                 AnalyzerProperties properties) {
        this.tables = tables;
        this.textNormalizer = textNormalizer;
        this.sectionSegmenter = sectionSegmenter;
        this.entityExtractor = entityExtractor;
        this.categoryScorer = categoryScorer;
        this.aggregateScorer = aggregateScorer;
        this.roleMatcher = roleMatcher;
        this.strengthWeaknessAnalyzer = strengthWeaknessAnalyzer;
        this.contentValidator = contentValidator;
        this.aiInsightService = aiInsightService;
        this.defaultAiTimeout = Duration.ofMillis(properties.getAi().getTimeoutMs());
    }

    /**
     * Analyze extracted resume text
     * @param text extracted text, may be {@code null}
     * @param sourceByteSize size of the source document
     * @param readable extraction verdict on text density
     * @param options roles to match and AI preferences
     * @return the analysis, or a content-too-sparse result for unusable input
     * @throws UnknownRoleException if the options name a role that is not configured
     */
    public AnalysisResult analyze(String text, long sourceByteSize, boolean readable, AnalysisOptions options) {
        List<RoleProfile> roles = resolveRoles(options.getRoles());

        RawDocument document = textNormalizer.normalize(text, sourceByteSize);
        Optional<SparseContent> sparse = checkDensity(document, readable);
        if (sparse.isPresent()) {
            logger.info("Refusing to score sparse content: {}", sparse.get().getReason());
            return AnalysisResult.contentTooSparse(sparse.get());
        }

        List<Section> sections = sectionSegmenter.segment(document);
        ResumeProfile profile = entityExtractor.extract(document, sections);
        List<CategoryScore> categoryScores = categoryScorer.score(profile);
        ScoreReport scoreReport = aggregateScorer.aggregate(categoryScores);
        List<RoleMatchResult> roleMatches = roleMatcher.matchAll(profile, roles);
        StrengthWeaknessReport judgments = strengthWeaknessAnalyzer.analyze(profile, scoreReport);
        ContentValidation validation = contentValidator.validate(document);

        Duration timeout = options.getAiTimeout() != null ? options.getAiTimeout() : defaultAiTimeout;
        AiInsight aiInsight = null;
        if (options.isIncludeAi()) {
            aiInsight = aiInsightService.generate(profile, scoreReport, options.getTargetRole(), timeout);
        }
        AiInsight improvementPlan = null;
        if (options.isIncludeImprovementPlan()) {
            improvementPlan = aiInsightService.generateImprovementPlan(
                    profile, judgments.getWeaknesses(), options.getTargetRole(), timeout);
        }

        logger.info("Analyzed resume: {} lines, {} sections, total {} ({})",
                document.lineCount(), sections.size(), scoreReport.getTotalPoints(),
                scoreReport.getGrade().getName());

        return AnalysisResult.analyzed(AnalysisReport.builder()
                .profile(profile)
                .scoreReport(scoreReport)
                .roleMatches(roleMatches)
                .strengths(judgments.getStrengths())
                .weaknesses(judgments.getWeaknesses())
                .aiInsight(aiInsight)
                .improvementPlan(improvementPlan)
                .build(), validation);
    }

    public AnalysisResult analyze(String text, long sourceByteSize, boolean readable) {
        return analyze(text, sourceByteSize, readable, AnalysisOptions.defaults());
    }

    private Optional<SparseContent> checkDensity(RawDocument document, boolean readable) {
        int characters = document.characterCount();
        int words = document.isEmpty() ? 0 : document.wordCount();

        String reason = null;
        if (document.isEmpty()) {
            reason = "no usable text was extracted";
        } else if (!readable) {
            reason = "extracted text is not readable";
        } else if (characters < tables.getMinCharacters()) {
            reason = "only " + characters + " characters of text (minimum " + tables.getMinCharacters() + ")";
        } else if (words < tables.getMinWords()) {
            reason = "only " + words + " words of text (minimum " + tables.getMinWords() + ")";
        }

        if (reason == null) {
            return Optional.empty();
        }
        return Optional.of(SparseContent.builder()
                .reason(reason)
                .characterCount(characters)
                .wordCount(words)
                .minCharacters(tables.getMinCharacters())
                .minWords(tables.getMinWords())
                .build());
    }

    /**
     * Configured roles by name, case-insensitive; all roles for an empty list.
     * @throws UnknownRoleException if any name is not configured
     */
    public List<RoleProfile> resolveRoles(List<String> names) {
        if (names == null || names.isEmpty()) {
            return tables.getRoles();
        }
        List<RoleProfile> roles = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        for (String name : names) {
            Optional<RoleProfile> role = tables.findRole(name);
            if (role.isPresent()) {
                if (!roles.contains(role.get())) {
                    roles.add(role.get());
                }
            } else {
                unknown.add(name);
            }
        }
        if (!unknown.isEmpty()) {
            throw new UnknownRoleException(unknown);
        }
        return roles;
    }
}
