package com.raketman.resumeanalyzer.dto;

import jakarta.validation.constraints.NotBlank;
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
public class DirectoryAnalysisRequest {

    @NotBlank(message = "Input directory is required")
    private String inputDirectory;

    @Builder.Default
    private List<String> roles = new ArrayList<>();
}
