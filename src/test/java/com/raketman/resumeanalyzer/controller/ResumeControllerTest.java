package com.raketman.resumeanalyzer.controller;

import com.raketman.resumeanalyzer.ai.AiCostEstimator;
import com.raketman.resumeanalyzer.ai.AiInsightService;
import com.raketman.resumeanalyzer.exception.DirectoryAnalysisException;
import com.raketman.resumeanalyzer.exception.DocumentParsingException;
import com.raketman.resumeanalyzer.exception.UnknownRoleException;
import com.raketman.resumeanalyzer.model.AiConnectionStatus;
import com.raketman.resumeanalyzer.model.AiCostEstimate;
import com.raketman.resumeanalyzer.model.AnalysisReport;
import com.raketman.resumeanalyzer.model.AnalysisResult;
import com.raketman.resumeanalyzer.model.ExperienceLevel;
import com.raketman.resumeanalyzer.model.RequiredSkill;
import com.raketman.resumeanalyzer.model.RoleProfile;
import com.raketman.resumeanalyzer.model.SparseContent;
import com.raketman.resumeanalyzer.service.AnalysisOptions;
import com.raketman.resumeanalyzer.service.AnalyzerCatalogService;
import com.raketman.resumeanalyzer.service.BatchAnalysisService;
import com.raketman.resumeanalyzer.service.DocumentParserService;
import com.raketman.resumeanalyzer.service.ResumeAnalysisService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.io.InputStream;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ResumeController.class)
class ResumeControllerTest {

    @Autowired private MockMvc mockMvc;

    @MockitoBean private ResumeAnalysisService resumeAnalysisService;
    @MockitoBean private BatchAnalysisService batchAnalysisService;
    @MockitoBean private DocumentParserService documentParserService;
    @MockitoBean private AnalyzerCatalogService analyzerCatalogService;
    @MockitoBean private AiInsightService aiInsightService;
    @MockitoBean private AiCostEstimator aiCostEstimator;

    private static AnalysisResult analyzedResult() {
        return AnalysisResult.analyzed(AnalysisReport.builder()
                .roleMatches(List.of())
                .strengths(List.of())
                .weaknesses(List.of())
                .build());
    }

    @Test
    void analyzeText_returnsWrappedResult() throws Exception {
        when(resumeAnalysisService.analyze(anyString(), anyLong(), anyBoolean(), any(AnalysisOptions.class)))
                .thenReturn(analyzedResult());

        mockMvc.perform(post("/api/v1/resumes/analyze/text")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Jane Doe resume\",\"roles\":[\"Backend Developer\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Resume analyzed"))
                .andExpect(jsonPath("$.data.status").value("ANALYZED"));

        ArgumentCaptor<AnalysisOptions> options = ArgumentCaptor.forClass(AnalysisOptions.class);
        verify(resumeAnalysisService).analyze(eq("Jane Doe resume"), eq(15L), eq(true), options.capture());
        assertThat(options.getValue().getRoles()).containsExactly("Backend Developer");
        assertThat(options.getValue().isIncludeAi()).isFalse();
        assertThat(options.getValue().isIncludeImprovementPlan()).isFalse();
    }

    @Test
    void analyzeText_improvementPlanIsPassedThrough() throws Exception {
        when(resumeAnalysisService.analyze(anyString(), anyLong(), anyBoolean(), any(AnalysisOptions.class)))
                .thenReturn(analyzedResult());

        mockMvc.perform(post("/api/v1/resumes/analyze/text")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Jane Doe resume\",\"includeImprovementPlan\":true,"
                                + "\"targetRole\":\"Data Scientist\"}"))
                .andExpect(status().isOk());

        ArgumentCaptor<AnalysisOptions> options = ArgumentCaptor.forClass(AnalysisOptions.class);
        verify(resumeAnalysisService).analyze(anyString(), anyLong(), anyBoolean(), options.capture());
        assertThat(options.getValue().isIncludeImprovementPlan()).isTrue();
        assertThat(options.getValue().getTargetRole()).isEqualTo("Data Scientist");
    }

    @Test
    void analyzeText_sparseContentIsNotAnError() throws Exception {
        when(resumeAnalysisService.analyze(anyString(), anyLong(), anyBoolean(), any(AnalysisOptions.class)))
                .thenReturn(AnalysisResult.contentTooSparse(SparseContent.builder()
                        .reason("only 8 characters of text, at least 100 required")
                        .characterCount(8)
                        .minCharacters(100)
                        .minWords(30)
                        .build()));

        mockMvc.perform(post("/api/v1/resumes/analyze/text")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Jane Doe\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Resume content too sparse to score"))
                .andExpect(jsonPath("$.data.status").value("CONTENT_TOO_SPARSE"))
                .andExpect(jsonPath("$.data.sparseContent.minCharacters").value(100));
    }

    @Test
    void analyzeText_missingTextIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/resumes/analyze/text")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"roles\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("Validation error: Resume text is required"));

        verifyNoInteractions(resumeAnalysisService);
    }

    @Test
    void analyzeText_unknownRoleIsBadRequest() throws Exception {
        when(resumeAnalysisService.analyze(anyString(), anyLong(), anyBoolean(), any(AnalysisOptions.class)))
                .thenThrow(new UnknownRoleException(List.of("Astronaut")));

        mockMvc.perform(post("/api/v1/resumes/analyze/text")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Jane Doe resume\",\"roles\":[\"Astronaut\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("UNKNOWN_ROLE"))
                .andExpect(jsonPath("$.message").value("Unknown role(s): Astronaut"))
                .andExpect(jsonPath("$.path").value("/api/v1/resumes/analyze/text"));
    }

    @Test
    void analyzeDocument_parsesUploadAndNamesResult() throws Exception {
        MockMultipartFile file = new MockMultipartFile(
                "file", "resume.txt", MediaType.TEXT_PLAIN_VALUE, "Jane Doe resume".getBytes());
        when(documentParserService.parseDocument(eq("resume.txt"), eq(15L), any(InputStream.class)))
                .thenReturn(DocumentParserService.ExtractedText.builder()
                        .text("Jane Doe resume")
                        .sourceByteSize(15)
                        .readable(true)
                        .build());
        when(resumeAnalysisService.analyze(eq("Jane Doe resume"), eq(15L), eq(true), any(AnalysisOptions.class)))
                .thenReturn(analyzedResult());

        mockMvc.perform(multipart("/api/v1/resumes/analyze").file(file).param("includeAi", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sourceName").value("resume.txt"))
                .andExpect(jsonPath("$.data.status").value("ANALYZED"));
    }

    @Test
    void analyzeDocument_parsingFailureIsBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile(
                "file", "resume.exe", MediaType.APPLICATION_OCTET_STREAM_VALUE, new byte[]{1, 2, 3});
        when(documentParserService.parseDocument(anyString(), anyLong(), any(InputStream.class)))
                .thenThrow(new DocumentParsingException("Unsupported file format: exe"));

        mockMvc.perform(multipart("/api/v1/resumes/analyze").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("DOCUMENT_PARSING_ERROR"))
                .andExpect(jsonPath("$.message").value("Unsupported file format: exe"));

        verifyNoInteractions(resumeAnalysisService);
    }

    @Test
    void analyzeDirectory_invalidDirectoryIsBadRequest() throws Exception {
        when(batchAnalysisService.analyzeDirectory(eq("/no/such/dir"), any(AnalysisOptions.class)))
                .thenThrow(new DirectoryAnalysisException("/no/such/dir", "Invalid directory: /no/such/dir"));

        mockMvc.perform(post("/api/v1/resumes/analyze/directory")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"inputDirectory\":\"/no/such/dir\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("DIRECTORY_ANALYSIS_ERROR"));
    }

    @Test
    void getRoles_listsConfiguredProfiles() throws Exception {
        when(analyzerCatalogService.getRoles()).thenReturn(List.of(RoleProfile.builder()
                .name("Backend Developer")
                .experienceLevel(ExperienceLevel.MID)
                .requiredSkills(List.of(RequiredSkill.builder().skillId("java").name("Java").weight(20).build()))
                .build()));

        mockMvc.perform(get("/api/v1/resumes/roles"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Role profiles retrieved"))
                .andExpect(jsonPath("$.data[0].name").value("Backend Developer"))
                .andExpect(jsonPath("$.data[0].requiredSkills[0].weight").value(20));
    }

    @Test
    void getAiStatus_reportsConnectionVerdict() throws Exception {
        when(aiInsightService.checkConnection(Duration.ofMillis(10000)))
                .thenReturn(AiConnectionStatus.invalid("No API key provided"));

        mockMvc.perform(get("/api/v1/resumes/ai/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("AI connection checked"))
                .andExpect(jsonPath("$.data.valid").value(false))
                .andExpect(jsonPath("$.data.message").value("No API key provided"));
    }

    @Test
    void getAiStatus_honorsRequestedTimeout() throws Exception {
        when(aiInsightService.checkConnection(any(Duration.class)))
                .thenReturn(AiConnectionStatus.valid("API key validated successfully"));

        mockMvc.perform(get("/api/v1/resumes/ai/status").param("timeoutMs", "2500"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.valid").value(true));

        verify(aiInsightService).checkConnection(Duration.ofMillis(2500));
    }

    @Test
    void estimateAiCost_returnsEstimate() throws Exception {
        when(aiCostEstimator.estimate("Jane Doe resume", "Data Engineer")).thenReturn(AiCostEstimate.builder()
                .inputTokens(1003)
                .outputTokens(1500)
                .estimatedTokens(2503)
                .estimatedCostUsd(new BigDecimal("0.0075"))
                .analysisTypes(List.of("Comprehensive Analysis", "Role-Specific Analysis"))
                .build());

        mockMvc.perform(post("/api/v1/resumes/ai/estimate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Jane Doe resume\",\"targetRole\":\"Data Engineer\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("AI cost estimate calculated"))
                .andExpect(jsonPath("$.data.estimatedTokens").value(2503))
                .andExpect(jsonPath("$.data.estimatedCostUsd").value(0.0075))
                .andExpect(jsonPath("$.data.analysisTypes[1]").value("Role-Specific Analysis"));
    }

    @Test
    void estimateAiCost_missingTextIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/resumes/ai/estimate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        verifyNoInteractions(aiCostEstimator);
    }
}
