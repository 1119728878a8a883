package com.raketman.resumeanalyzer.ai;

import com.raketman.resumeanalyzer.config.CacheConfig;
import com.raketman.resumeanalyzer.exception.AiNarrativeException;
import com.raketman.resumeanalyzer.model.AiConnectionStatus;
import com.raketman.resumeanalyzer.model.ResumeProfile;
import com.raketman.resumeanalyzer.model.ScoreReport;
import com.raketman.resumeanalyzer.model.Weakness;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.cache.annotation.Cacheable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Narrative generation through a Spring AI {@link ChatClient}. Identical analyses reuse the
 * cached narrative.
 */
public class ChatClientNarrativeGenerator implements NarrativeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ChatClientNarrativeGenerator.class);

    private static final ChatOptions IMPROVEMENT_OPTIONS = ChatOptions.builder()
            .temperature(0.3)
            .maxTokens(1000)
            .build();

    private static final ChatOptions CONNECTION_CHECK_OPTIONS = ChatOptions.builder()
            .maxTokens(5)
            .build();

    private final ChatClient chatClient;
    private final NarrativePrompts prompts;

    public ChatClientNarrativeGenerator(ChatClient chatClient, NarrativePrompts prompts) {
        this.chatClient = chatClient;
        this.prompts = prompts;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    @Cacheable(CacheConfig.AI_NARRATIVES)
    public String generate(ResumeProfile profile, ScoreReport report, String targetRole) {
        List<Message> promptMessages = new ArrayList<>();
        promptMessages.add(prompts.systemMessage(targetRole));
        promptMessages.add(prompts.userMessage(profile, report, targetRole));
        return call("narrative", new Prompt(promptMessages));
    }

    @Override
    @Cacheable(CacheConfig.AI_IMPROVEMENT_PLANS)
    public String improvementPlan(ResumeProfile profile, List<Weakness> weaknesses, String targetRole) {
        List<Message> promptMessages = new ArrayList<>();
        promptMessages.add(prompts.improvementSystemMessage());
        promptMessages.add(prompts.improvementUserMessage(profile, weaknesses, targetRole));
        return call("improvement plan", new Prompt(promptMessages, IMPROVEMENT_OPTIONS));
    }

    @Override
    public AiConnectionStatus checkConnection() {
        try {
            chatClient.prompt(new Prompt(new UserMessage("Test"), CONNECTION_CHECK_OPTIONS))
                    .call()
                    .content();
            return AiConnectionStatus.valid("API key validated successfully");
        } catch (RuntimeException e) {
            logger.warn("AI connection check failed: {}", e.getMessage());
            return AiConnectionStatus.invalid(describeFailure(e));
        }
    }

    private String call(String what, Prompt prompt) {
        long startTime = System.currentTimeMillis();
        String content;
        try {
            content = chatClient
                    .prompt(prompt)
                    .call()
                    .content();
        } catch (RuntimeException e) {
            throw new AiNarrativeException(what + " request failed: " + e.getMessage(), e);
        }

        if (content == null || content.isBlank()) {
            throw new AiNarrativeException("provider returned an empty " + what);
        }
        logger.debug("Generated AI {} of {} characters in {}ms",
                what, content.length(), System.currentTimeMillis() - startTime);
        return content.trim();
    }

    private static String describeFailure(RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("401") || lower.contains("invalid_api_key") || lower.contains("incorrect api key")) {
            return "Invalid API key - please check your OpenAI API key";
        }
        if (lower.contains("429") || lower.contains("rate limit")) {
            return "API rate limit exceeded - please try again later";
        }
        return "Connection error: " + message;
    }
}
