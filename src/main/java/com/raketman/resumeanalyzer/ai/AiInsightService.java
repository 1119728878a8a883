package com.raketman.resumeanalyzer.ai;

import com.raketman.resumeanalyzer.model.AiConnectionStatus;
import com.raketman.resumeanalyzer.model.AiInsight;
import com.raketman.resumeanalyzer.model.ResumeProfile;
import com.raketman.resumeanalyzer.model.ScoreReport;
import com.raketman.resumeanalyzer.model.Weakness;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Time-boxed boundary around the narrative generator. Whatever happens on the remote side,
 * callers get an {@link AiInsight} or an {@link AiConnectionStatus}, never an exception.
 */
@Service
public class AiInsightService {

    private static final Logger logger = LoggerFactory.getLogger(AiInsightService.class);

    private final NarrativeGenerator narrativeGenerator;
    private final Executor executor;

    public AiInsightService(NarrativeGenerator narrativeGenerator,
                            @Qualifier("aiNarrativeExecutor") Executor executor) {
        this.narrativeGenerator = narrativeGenerator;
        this.executor = executor;
    }

    public AiInsight generate(ResumeProfile profile, ScoreReport report, String targetRole, Duration timeout) {
        if (!narrativeGenerator.isAvailable()) {
            return AiInsight.disabled();
        }
        return timeBoxed("narrative",
                () -> AiInsight.generated(narrativeGenerator.generate(profile, report, targetRole)),
                timeout, AiInsight::unavailable);
    }

    public AiInsight generateImprovementPlan(ResumeProfile profile, List<Weakness> weaknesses,
                                             String targetRole, Duration timeout) {
        if (!narrativeGenerator.isAvailable()) {
            return AiInsight.disabled();
        }
        return timeBoxed("improvement plan",
                () -> AiInsight.generated(narrativeGenerator.improvementPlan(profile, weaknesses, targetRole)),
                timeout, AiInsight::unavailable);
    }

    public AiConnectionStatus checkConnection(Duration timeout) {
        if (!narrativeGenerator.isAvailable()) {
            return narrativeGenerator.checkConnection();
        }
        return timeBoxed("connection check", narrativeGenerator::checkConnection,
                timeout, reason -> AiConnectionStatus.invalid("Connection check failed: " + reason));
    }

    private <T> T timeBoxed(String label, Supplier<T> call, Duration timeout, Function<String, T> fallback) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(call, executor);
        } catch (RejectedExecutionException e) {
            logger.warn("AI {} request rejected: {}", label, e.getMessage());
            return fallback.apply("too many concurrent requests");
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("AI {} timed out after {}ms", label, timeout.toMillis());
            return fallback.apply("timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            logger.warn("AI {} failed: {}", label, reason);
            return fallback.apply(reason);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            logger.warn("Interrupted while waiting for AI {}", label);
            return fallback.apply("interrupted");
        }
    }
}
