package com.raketman.resumeanalyzer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for directory fan-out and for the time-boxed AI narrative call.
 */
@Configuration
public class AsyncConfig {

    private static final Logger logger = LoggerFactory.getLogger(AsyncConfig.class);

    /**
     * Runs one independent pipeline per resume file during directory analysis
     */
    @Bean(name = "analysisExecutor")
    public Executor analysisExecutor(AnalyzerProperties properties) {
        AnalyzerProperties.Executor config = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        int corePoolSize = Math.max(1, config.getAnalysisPoolSize());
        int maxPoolSize = Math.max(corePoolSize, Runtime.getRuntime().availableProcessors());

        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(config.getAnalysisQueueCapacity());
        executor.setThreadNamePrefix("resume-analysis-");
        executor.setKeepAliveSeconds(60);

        executor.setRejectedExecutionHandler((runnable, threadPoolExecutor) -> {
            logger.warn("Resume analysis task rejected. Queue full. Running in caller thread.");
            if (!threadPoolExecutor.isShutdown()) {
                runnable.run();
            }
        });

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        logger.info("Initialized resume analysis executor with core pool size: {}, max pool size: {}",
                corePoolSize, maxPoolSize);

        return executor;
    }

    /**
     * Bounded pool for remote narrative generation calls
     */
    @Bean(name = "aiNarrativeExecutor")
    public Executor aiNarrativeExecutor(AnalyzerProperties properties) {
        AnalyzerProperties.Executor config = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        int poolSize = Math.max(1, config.getAiPoolSize());
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(config.getAiQueueCapacity());
        executor.setThreadNamePrefix("ai-narrative-");
        executor.setKeepAliveSeconds(120);

        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);

        executor.initialize();

        logger.info("Initialized AI narrative executor with pool size: {}", poolSize);

        return executor;
    }
}
