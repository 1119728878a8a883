package com.raketman.resumeanalyzer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one pipeline run: either a full report or the reason the content was refused.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisResult {

    public enum Status {
        ANALYZED,
        CONTENT_TOO_SPARSE
    }

    Status status;
    String sourceName;
    AnalysisReport report;
    ContentValidation validation;
    SparseContent sparseContent;

    public static AnalysisResult analyzed(AnalysisReport report) {
        return AnalysisResult.builder().status(Status.ANALYZED).report(report).build();
    }

    public static AnalysisResult analyzed(AnalysisReport report, ContentValidation validation) {
        return AnalysisResult.builder().status(Status.ANALYZED).report(report).validation(validation).build();
    }

    public static AnalysisResult contentTooSparse(SparseContent sparseContent) {
        return AnalysisResult.builder().status(Status.CONTENT_TOO_SPARSE).sparseContent(sparseContent).build();
    }

    public AnalysisResult withSourceName(String name) {
        return toBuilder().sourceName(name).build();
    }

    public boolean isAnalyzed() {
        return status == Status.ANALYZED;
    }
}
