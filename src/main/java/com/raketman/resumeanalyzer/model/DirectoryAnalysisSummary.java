package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DirectoryAnalysisSummary {

    @Value
    @Builder
    public static class FileFailure {
        String fileName;
        String error;
    }

    String inputDirectory;
    int filesFound;
    int analyzedCount;
    int sparseCount;
    int failedCount;
    long processingTimeMs;
    List<AnalysisResult> results;
    List<FileFailure> failures;
}
