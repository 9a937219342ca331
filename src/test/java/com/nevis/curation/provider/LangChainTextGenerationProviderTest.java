package com.nevis.curation.provider;

import com.nevis.curation.exception.GenerationUnavailableException;
import com.nevis.curation.infra.RateLimiter;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LangChainTextGenerationProviderTest {

    @Mock
    private ChatModel chatModel;

    private final List<String> acquiredKeys = new ArrayList<>();

    private LangChainTextGenerationProvider provider;

    @BeforeEach
    void setUp() {
        RateLimiter recording = (key, permits) -> acquiredKeys.add(key);
        provider = new LangChainTextGenerationProvider(chatModel, recording);
    }

    @Test
    @DisplayName("Should send the rendered prompt through the chat limiter")
    void shouldGenerateThroughLimiter() {
        GenerationPrompt prompt = new GenerationPrompt(GenerationTask.CLUSTER_SUMMARY, "Summarize", "Some text");
        when(chatModel.chat(prompt.render())).thenReturn("  A summary.  ");

        assertThat(provider.generate(prompt)).isEqualTo("A summary.");
        assertThat(acquiredKeys).containsExactly(LangChainTextGenerationProvider.CHAT_LIMIT);
        verify(chatModel).chat(prompt.render());
    }

    @Test
    @DisplayName("Should wrap model failures into GenerationUnavailableException")
    void shouldWrapModelFailure() {
        when(chatModel.chat(anyString())).thenThrow(new RuntimeException("quota exceeded"));

        assertThatThrownBy(() -> provider.generate(new GenerationPrompt(GenerationTask.SCORING_SIGNALS, "", "x")))
            .isInstanceOf(GenerationUnavailableException.class)
            .hasMessageContaining("SCORING_SIGNALS")
            .hasRootCauseMessage("quota exceeded");
    }

    @Test
    @DisplayName("Should treat a blank answer as unavailable")
    void shouldRejectBlankAnswer() {
        when(chatModel.chat(anyString())).thenReturn("   ");

        assertThatThrownBy(() -> provider.generate(new GenerationPrompt(GenerationTask.CLUSTER_SUMMARY, "", "x")))
            .isInstanceOf(GenerationUnavailableException.class)
            .hasMessageContaining("no content");
    }
}
