package com.raketman.resumeanalyzer.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeTextRequest {

    @NotNull(message = "Resume text is required")
    @Size(max = 200000, message = "Resume text cannot exceed 200000 characters")
    private String text;

    @Builder.Default
    private Boolean readable = true;

    @Builder.Default
    private List<String> roles = new ArrayList<>();

    @Builder.Default
    private Boolean includeAi = false;

    @Builder.Default
    private Boolean includeImprovementPlan = false;

    @Size(max = 100, message = "Target role cannot exceed 100 characters")
    private String targetRole;

    @Min(value = 1000, message = "AI timeout must be at least 1000ms")
    @Max(value = 120000, message = "AI timeout cannot exceed 120000ms")
    private Long aiTimeoutMs;
}
