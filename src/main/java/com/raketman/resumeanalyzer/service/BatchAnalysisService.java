package com.raketman.resumeanalyzer.service;

import com.raketman.resumeanalyzer.exception.DirectoryAnalysisException;
import com.raketman.resumeanalyzer.exception.DocumentParsingException;
import com.raketman.resumeanalyzer.model.AnalysisResult;
import com.raketman.resumeanalyzer.model.DirectoryAnalysisSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Analyzes every supported resume file in a directory. Each file is an independent pipeline
 * run on the analysis executor; one bad file never fails the others.
 */
@Service
public class BatchAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(BatchAnalysisService.class);

    private final DocumentParserService documentParserService;
    private final ResumeAnalysisService resumeAnalysisService;
    private final Executor executor;

    public BatchAnalysisService(DocumentParserService documentParserService,
                                ResumeAnalysisService resumeAnalysisService,
                                @Qualifier("analysisExecutor") Executor executor) {
        this.documentParserService = documentParserService;
        this.resumeAnalysisService = resumeAnalysisService;
        this.executor = executor;
    }

    public DirectoryAnalysisSummary analyzeDirectory(String inputDirectory, AnalysisOptions options) {
        File directory = validateInputDirectory(inputDirectory);
        resumeAnalysisService.resolveRoles(options.getRoles());
        // AI narratives and improvement plans are per-request extras and are not generated in bulk
        AnalysisOptions batchOptions = AnalysisOptions.builder()
                .roles(options.getRoles())
                .includeAi(false)
                .includeImprovementPlan(false)
                .build();

        File[] listed = directory.listFiles(file -> file.isFile()
                && documentParserService.isSupportedFormat(file.getName()));
        List<File> files = listed == null ? List.of() : Arrays.stream(listed)
                .sorted(Comparator.comparing(File::getName))
                .collect(Collectors.toList());
        logger.info("Found {} resume files to analyze in directory: {}", files.size(), inputDirectory);

        long startTime = System.currentTimeMillis();
        List<CompletableFuture<FileOutcome>> futures = files.stream()
                .map(file -> CompletableFuture.supplyAsync(() -> analyzeFile(file, batchOptions), executor))
                .collect(Collectors.toList());

        List<FileOutcome> outcomes = new ArrayList<>();
        for (CompletableFuture<FileOutcome> future : futures) {
            try {
                outcomes.add(future.join());
            } catch (CompletionException e) {
                throw new DirectoryAnalysisException(inputDirectory, "Directory analysis failed", e.getCause());
            }
        }

        List<AnalysisResult> results = outcomes.stream()
                .map(FileOutcome::getResult)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
        List<DirectoryAnalysisSummary.FileFailure> failures = outcomes.stream()
                .map(FileOutcome::getFailure)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
        long elapsed = System.currentTimeMillis() - startTime;

        logger.info("Directory analysis of {} finished in {}ms: {} analyzed, {} failed",
                inputDirectory, elapsed, results.size(), failures.size());

        return DirectoryAnalysisSummary.builder()
                .inputDirectory(inputDirectory)
                .filesFound(files.size())
                .analyzedCount((int) results.stream().filter(AnalysisResult::isAnalyzed).count())
                .sparseCount((int) results.stream().filter(result -> !result.isAnalyzed()).count())
                .failedCount(failures.size())
                .processingTimeMs(elapsed)
                .results(List.copyOf(results))
                .failures(List.copyOf(failures))
                .build();
    }

    private FileOutcome analyzeFile(File file, AnalysisOptions options) {
        try {
            DocumentParserService.ExtractedText extracted = documentParserService.parseDocument(file);
            AnalysisResult result = resumeAnalysisService.analyze(
                    extracted.getText(), extracted.getSourceByteSize(), extracted.isReadable(), options);
            return FileOutcome.success(result.withSourceName(file.getName()));
        } catch (DocumentParsingException e) {
            logger.warn("Skipping {}: {}", file.getName(), e.getMessage());
            return FileOutcome.failure(file.getName(), e.getMessage());
        } catch (RuntimeException e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            logger.error("Unexpected error analyzing {}: {}", file.getName(), reason, e);
            return FileOutcome.failure(file.getName(), "Unexpected error: " + reason);
        }
    }

    private File validateInputDirectory(String inputDirectory) {
        File directory = new File(Optional.ofNullable(inputDirectory)
                .orElseThrow(() -> new DirectoryAnalysisException(null, "Input directory cannot be null")));

        if (!directory.exists() || !directory.isDirectory() || !directory.canRead()) {
            throw new DirectoryAnalysisException(inputDirectory, "Invalid directory: " + inputDirectory);
        }
        return directory;
    }

    private static final class FileOutcome {
        private final AnalysisResult result;
        private final DirectoryAnalysisSummary.FileFailure failure;

        private FileOutcome(AnalysisResult result, DirectoryAnalysisSummary.FileFailure failure) {
            this.result = result;
            this.failure = failure;
        }

        static FileOutcome success(AnalysisResult result) {
            return new FileOutcome(result, null);
        }

        static FileOutcome failure(String fileName, String error) {
            return new FileOutcome(null, DirectoryAnalysisSummary.FileFailure.builder()
                    .fileName(fileName)
                    .error(error)
                    .build());
        }

        Optional<AnalysisResult> getResult() {
            return Optional.ofNullable(result);
        }

        Optional<DirectoryAnalysisSummary.FileFailure> getFailure() {
            return Optional.ofNullable(failure);
        }
    }
}
