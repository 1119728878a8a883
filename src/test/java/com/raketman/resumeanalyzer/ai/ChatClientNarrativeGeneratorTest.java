package com.raketman.resumeanalyzer.ai;

import com.raketman.resumeanalyzer.AnalyzerFixtures;
import com.raketman.resumeanalyzer.exception.AiNarrativeException;
import com.raketman.resumeanalyzer.model.AiConnectionStatus;
import com.raketman.resumeanalyzer.model.AnalysisReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatClientNarrativeGeneratorTest {

    private final ChatClient chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
    private final ChatClientNarrativeGenerator generator =
            new ChatClientNarrativeGenerator(chatClient, new NarrativePrompts());

    private static String text(Prompt prompt) {
        return prompt.getInstructions().stream()
                .map(Message::getText)
                .collect(Collectors.joining("\n"));
    }

    @Nested
    @DisplayName("Connection check")
    class ConnectionCheck {

        @Test
        @DisplayName("a successful round trip validates the key")
        void valid() {
            when(chatClient.prompt(any(Prompt.class)).call().content()).thenReturn("ok");

            AiConnectionStatus status = generator.checkConnection();

            assertThat(status.isValid()).isTrue();
            assertThat(status.getMessage()).isEqualTo("API key validated successfully");
        }

        @Test
        @DisplayName("a rejected key is reported as invalid")
        void invalidKey() {
            when(chatClient.prompt(any(Prompt.class))).thenThrow(new RuntimeException("HTTP 401 - invalid_api_key"));

            AiConnectionStatus status = generator.checkConnection();

            assertThat(status.isValid()).isFalse();
            assertThat(status.getMessage()).isEqualTo("Invalid API key - please check your OpenAI API key");
        }

        @Test
        @DisplayName("throttling is reported as a rate limit")
        void rateLimited() {
            when(chatClient.prompt(any(Prompt.class))).thenThrow(new RuntimeException("429 Too Many Requests"));

            assertThat(generator.checkConnection().getMessage())
                    .isEqualTo("API rate limit exceeded - please try again later");
        }

        @Test
        @DisplayName("any other failure is a connection error")
        void connectionError() {
            when(chatClient.prompt(any(Prompt.class))).thenThrow(new IllegalStateException("connect timed out"));

            assertThat(generator.checkConnection().getMessage()).isEqualTo("Connection error: connect timed out");
        }
    }

    @Nested
    @DisplayName("Improvement plan")
    class ImprovementPlan {

        @Test
        @DisplayName("asks for the four plan sections built from the weakest categories")
        void promptCarriesWeaknesses() {
            AnalysisReport report = AnalyzerFixtures.analysisService()
                    .analyze(AnalyzerFixtures.UNSTRUCTURED_RESUME, 0, true)
                    .getReport();
            when(chatClient.prompt(any(Prompt.class)).call().content()).thenReturn("  ## IMMEDIATE CRITICAL FIXES\n");

            String plan = generator.improvementPlan(report.getProfile(), report.getWeaknesses(), "Data Scientist");

            assertThat(plan).isEqualTo("## IMMEDIATE CRITICAL FIXES");
            ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
            verify(chatClient, atLeastOnce()).prompt(captor.capture());
            Prompt prompt = captor.getAllValues().get(captor.getAllValues().size() - 1);
            assertThat(text(prompt))
                    .contains("expert career coach")
                    .contains(report.getWeaknesses().get(0).getStatement())
                    .contains("TARGET ROLE: Data Scientist")
                    .contains("## IMMEDIATE CRITICAL FIXES (next 1-2 weeks)")
                    .contains("## SPECIFIC LANGUAGE IMPROVEMENTS");
            assertThat(prompt.getOptions().getMaxTokens()).isEqualTo(1000);
        }

        @Test
        @DisplayName("an empty answer is a failure")
        void emptyAnswer() {
            AnalysisReport report = AnalyzerFixtures.analysisService()
                    .analyze(AnalyzerFixtures.STRONG_RESUME, 0, true)
                    .getReport();
            when(chatClient.prompt(any(Prompt.class)).call().content()).thenReturn(" ");

            assertThatThrownBy(() -> generator.improvementPlan(report.getProfile(), report.getWeaknesses(), null))
                    .isInstanceOf(AiNarrativeException.class)
                    .hasMessage("provider returned an empty improvement plan");
        }
    }
}
