package com.raketman.resumeanalyzer.config;

import com.raketman.resumeanalyzer.ai.AbsentNarrativeGenerator;
import com.raketman.resumeanalyzer.ai.ChatClientNarrativeGenerator;
import com.raketman.resumeanalyzer.ai.NarrativeGenerator;
import com.raketman.resumeanalyzer.ai.NarrativePrompts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Chooses the narrative generator variant once at startup: the OpenAI-backed one when enabled
 * with an API key, the absent one otherwise.
 */
@Configuration
public class AiNarrativeConfig {

    private static final Logger logger = LoggerFactory.getLogger(AiNarrativeConfig.class);

    @Bean
    public NarrativeGenerator narrativeGenerator(AnalyzerProperties properties, NarrativePrompts prompts) {
        AnalyzerProperties.Ai ai = properties.getAi();
        if (!ai.isEnabled()) {
            logger.info("AI narrative disabled by configuration");
            return new AbsentNarrativeGenerator("AI narrative disabled by configuration");
        }
        if (!StringUtils.hasText(ai.getApiKey())) {
            logger.warn("AI narrative enabled but no API key configured; continuing without it");
            return new AbsentNarrativeGenerator();
        }

        OpenAiApi openAiApi = OpenAiApi.builder()
                .baseUrl(ai.getBaseUrl())
                .apiKey(ai.getApiKey())
                .build();

        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(ai.getModel())
                .temperature(ai.getTemperature())
                .maxTokens(ai.getMaxTokens())
                .build();

        OpenAiChatModel chatModel = OpenAiChatModel.builder()
                .openAiApi(openAiApi)
                .defaultOptions(options)
                .build();

        logger.info("AI narrative enabled with model {} at {}", ai.getModel(), ai.getBaseUrl());
        return new ChatClientNarrativeGenerator(ChatClient.builder(chatModel).build(), prompts);
    }
}
