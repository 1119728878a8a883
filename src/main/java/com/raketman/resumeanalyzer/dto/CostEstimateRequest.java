package com.raketman.resumeanalyzer.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostEstimateRequest {

    @NotNull(message = "Resume text is required")
    @Size(max = 200000, message = "Resume text cannot exceed 200000 characters")
    private String text;

    @Size(max = 100, message = "Target role cannot exceed 100 characters")
    private String targetRole;
}
