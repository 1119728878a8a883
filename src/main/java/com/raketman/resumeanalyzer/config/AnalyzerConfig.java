package com.raketman.resumeanalyzer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AnalyzerProperties.class)
public class AnalyzerConfig {

    private static final Logger logger = LoggerFactory.getLogger(AnalyzerConfig.class);

    /**
     * Validated tables shared read-only by every analysis. A bad table stops the context here.
     */
    @Bean
    public AnalyzerTables analyzerTables(AnalyzerProperties properties) {
        AnalyzerTables tables = AnalyzerTables.from(properties);
        logger.info("Loaded analyzer tables: {} section kinds, {} skills, {} roles, {} grade tiers",
                tables.getHeadings().size(), tables.getSkills().size(),
                tables.getRoles().size(), tables.getGradeTiers().size());
        return tables;
    }

    /**
     * UTC, so "Present" resolves to the same month whatever zone the host runs in.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
