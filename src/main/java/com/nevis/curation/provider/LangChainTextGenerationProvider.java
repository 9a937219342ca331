package com.nevis.curation.provider;

import com.nevis.curation.exception.GenerationUnavailableException;
import com.nevis.curation.infra.RateLimiter;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LangChainTextGenerationProvider implements TextGenerationProvider {

    public static final String CHAT_LIMIT = "chat_limit";

    private final ChatModel chatModel;
    private final RateLimiter chatLimiter;

    public LangChainTextGenerationProvider(ChatModel chatModel, RateLimiter chatLimiter) {
        this.chatModel = chatModel;
        this.chatLimiter = chatLimiter;
    }

    @Override
    public String generate(GenerationPrompt prompt) {
        String answer;
        try {
            answer = chatLimiter.execute(CHAT_LIMIT, 1, () -> chatModel.chat(prompt.render()));
        } catch (Exception e) {
            log.error("Generation failed for task {}: {}", prompt.task(), e.getMessage());
            throw new GenerationUnavailableException("Text generation failed for " + prompt.task(), e);
        }

        if (answer == null || answer.isBlank()) {
            throw new GenerationUnavailableException("Text generation returned no content for " + prompt.task());
        }
        return answer.trim();
    }
}
