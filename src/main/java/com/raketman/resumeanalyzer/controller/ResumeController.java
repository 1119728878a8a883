package com.raketman.resumeanalyzer.controller;

import com.raketman.resumeanalyzer.ai.AiCostEstimator;
import com.raketman.resumeanalyzer.ai.AiInsightService;
import com.raketman.resumeanalyzer.dto.AnalyzeTextRequest;
import com.raketman.resumeanalyzer.dto.CostEstimateRequest;
import com.raketman.resumeanalyzer.dto.DirectoryAnalysisRequest;
import com.raketman.resumeanalyzer.dto.ServiceResponse;
import com.raketman.resumeanalyzer.exception.DocumentParsingException;
import com.raketman.resumeanalyzer.model.AiConnectionStatus;
import com.raketman.resumeanalyzer.model.AiCostEstimate;
import com.raketman.resumeanalyzer.model.AnalysisResult;
import com.raketman.resumeanalyzer.model.DirectoryAnalysisSummary;
import com.raketman.resumeanalyzer.model.RoleProfile;
import com.raketman.resumeanalyzer.model.SkillCategory;
import com.raketman.resumeanalyzer.model.SkillDefinition;
import com.raketman.resumeanalyzer.service.AnalysisOptions;
import com.raketman.resumeanalyzer.service.AnalyzerCatalogService;
import com.raketman.resumeanalyzer.service.BatchAnalysisService;
import com.raketman.resumeanalyzer.service.DocumentParserService;
import com.raketman.resumeanalyzer.service.ResumeAnalysisService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/resumes")
@CrossOrigin(origins = "*", maxAge = 3600)
@RequiredArgsConstructor
@Validated
public class ResumeController {

    private final ResumeAnalysisService resumeAnalysisService;
    private final BatchAnalysisService batchAnalysisService;
    private final DocumentParserService documentParserService;
    private final AnalyzerCatalogService analyzerCatalogService;
    private final AiInsightService aiInsightService;
    private final AiCostEstimator aiCostEstimator;

    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ServiceResponse<AnalysisResult>> analyzeDocument(
            @RequestPart("file") MultipartFile file,
            @RequestParam(required = false) List<String> roles,
            @RequestParam(defaultValue = "false") boolean includeAi,
            @RequestParam(defaultValue = "false") boolean includeImprovementPlan,
            @RequestParam(required = false) String targetRole,
            @Min(value = 1000, message = "AI timeout must be at least 1000ms")
            @Max(value = 120000, message = "AI timeout cannot exceed 120000ms")
            @RequestParam(required = false) Long aiTimeoutMs) {

        DocumentParserService.ExtractedText extracted;
        try (InputStream content = file.getInputStream()) {
            extracted = documentParserService.parseDocument(file.getOriginalFilename(), file.getSize(), content);
        } catch (IOException e) {
            throw new DocumentParsingException("Failed to read upload: " + file.getOriginalFilename(), e);
        }

        AnalysisResult result = resumeAnalysisService.analyze(
                extracted.getText(),
                extracted.getSourceByteSize(),
                extracted.isReadable(),
                options(roles, includeAi, includeImprovementPlan, targetRole, aiTimeoutMs)
        ).withSourceName(file.getOriginalFilename());

        return ResponseEntity.ok(new ServiceResponse<>(true, messageFor(result), result));
    }

    @PostMapping("/analyze/text")
    public ResponseEntity<ServiceResponse<AnalysisResult>> analyzeText(
            @Valid @RequestBody AnalyzeTextRequest request) {

        AnalysisResult result = resumeAnalysisService.analyze(
                request.getText(),
                request.getText().getBytes(StandardCharsets.UTF_8).length,
                !Boolean.FALSE.equals(request.getReadable()),
                options(request.getRoles(), Boolean.TRUE.equals(request.getIncludeAi()),
                        Boolean.TRUE.equals(request.getIncludeImprovementPlan()),
                        request.getTargetRole(), request.getAiTimeoutMs())
        );

        return ResponseEntity.ok(new ServiceResponse<>(true, messageFor(result), result));
    }

    @PostMapping("/analyze/directory")
    public ResponseEntity<ServiceResponse<DirectoryAnalysisSummary>> analyzeDirectory(
            @Valid @RequestBody DirectoryAnalysisRequest request) {

        DirectoryAnalysisSummary summary = batchAnalysisService.analyzeDirectory(
                request.getInputDirectory(),
                options(request.getRoles(), false, false, null, null)
        );

        return ResponseEntity.ok(new ServiceResponse<>(true, "Directory analysis completed", summary));
    }

    @GetMapping("/roles")
    public ResponseEntity<ServiceResponse<List<RoleProfile>>> getRoles() {
        return ResponseEntity.ok(new ServiceResponse<>(true, "Role profiles retrieved",
                analyzerCatalogService.getRoles()));
    }

    @GetMapping("/skills")
    public ResponseEntity<ServiceResponse<Map<SkillCategory, List<SkillDefinition>>>> getSkills() {
        return ResponseEntity.ok(new ServiceResponse<>(true, "Skill taxonomy retrieved",
                analyzerCatalogService.getSkillsByCategory()));
    }

    @GetMapping("/config/scoring")
    public ResponseEntity<ServiceResponse<Map<String, Object>>> getScoringConfig() {
        return ResponseEntity.ok(new ServiceResponse<>(true, "Scoring configuration retrieved",
                analyzerCatalogService.getScoringConfiguration()));
    }

    @GetMapping("/ai/status")
    public ResponseEntity<ServiceResponse<AiConnectionStatus>> getAiStatus(
            @Min(value = 1000, message = "Timeout must be at least 1000ms")
            @Max(value = 60000, message = "Timeout cannot exceed 60000ms")
            @RequestParam(defaultValue = "10000") long timeoutMs) {

        AiConnectionStatus status = aiInsightService.checkConnection(Duration.ofMillis(timeoutMs));
        return ResponseEntity.ok(new ServiceResponse<>(true, "AI connection checked", status));
    }

    @PostMapping("/ai/estimate")
    public ResponseEntity<ServiceResponse<AiCostEstimate>> estimateAiCost(
            @Valid @RequestBody CostEstimateRequest request) {

        AiCostEstimate estimate = aiCostEstimator.estimate(request.getText(), request.getTargetRole());
        return ResponseEntity.ok(new ServiceResponse<>(true, "AI cost estimate calculated", estimate));
    }

    private AnalysisOptions options(List<String> roles, boolean includeAi, boolean includeImprovementPlan,
                                    String targetRole, Long aiTimeoutMs) {
        return AnalysisOptions.builder()
                .roles(roles != null ? roles : List.of())
                .includeAi(includeAi)
                .includeImprovementPlan(includeImprovementPlan)
                .targetRole(targetRole)
                .aiTimeout(aiTimeoutMs != null ? Duration.ofMillis(aiTimeoutMs) : null)
                .build();
    }

    private String messageFor(AnalysisResult result) {
        return result.isAnalyzed() ? "Resume analyzed" : "Resume content too sparse to score";
    }
}
