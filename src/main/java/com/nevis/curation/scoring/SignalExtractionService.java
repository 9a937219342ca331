package com.nevis.curation.scoring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.curation.exception.GenerationUnavailableException;
import com.nevis.curation.model.ContentItem;
import com.nevis.curation.provider.GenerationPrompt;
import com.nevis.curation.provider.GenerationTask;
import com.nevis.curation.provider.TextGenerationProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Asks the text-generation provider to assess an item against the configured topic catalogue and parses the
 * answer into {@link ScoringSignals}.
 */
@Service
@Slf4j
public class SignalExtractionService {

    private static final String SIGNAL_INSTRUCTIONS =
        """
            Role: Senior Market Intelligence Analyst.
            Task: Assess the article below against the tracked topics.
            Return a JSON object with exactly these fields, every number between 0 and 1:
              "alignments": [{"topic": <topic id>, "alignment": <number>}] for each topic the article touches,
              "classifications": [{"topic": <topic id>, "confidence": <number>}] for the topics it is about,
              "actionability", "risk", "stakeholder_relevance": <number>,
              "quality": {"factual_density", "source_authority", "clarity", "completeness", "verification_level"}
            Constraint: Use only the topic ids listed. Omit a field when the article gives no evidence for it.

            Output: Output only the JSON object
            """;

    private final TextGenerationProvider generationProvider;
    private final ScoringProperties properties;
    private final ObjectMapper objectMapper;

    @Value("${app.scoring.max-input-chars:12000}")
    private int maxInputChars = 12000;

    public SignalExtractionService(TextGenerationProvider generationProvider, ScoringProperties properties,
                                   ObjectMapper objectMapper) {
        this.generationProvider = generationProvider;
        this.properties = properties;
        this.objectMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @throws GenerationUnavailableException when the provider fails or answers with something that is not a
     *                                        signal object
     */
    public ScoringSignals extract(ContentItem item) {
        String answer = generationProvider.generate(
            new GenerationPrompt(GenerationTask.SCORING_SIGNALS, SIGNAL_INSTRUCTIONS + renderTopics(), renderItem(item)));

        try {
            ScoringSignals signals = objectMapper.readValue(stripFences(answer), ScoringSignals.class);
            if (signals == null) {
                throw new GenerationUnavailableException("Empty signal answer for item " + item.id());
            }
            log.debug("Extracted {} alignments and {} classifications for item {}",
                signals.alignments().size(), signals.classifications().size(), item.id());
            return signals;
        } catch (JsonProcessingException e) {
            throw new GenerationUnavailableException("Unparseable signal answer for item " + item.id(), e);
        }
    }

    private String renderTopics() {
        if (properties.topics().isEmpty()) {
            return "\nTopics:\n- general: anything of business relevance\n";
        }
        return properties.topics().stream()
            .map(topic -> "- " + topic.id() + ": " + Objects.toString(topic.name(), topic.id())
                + (topic.description() == null ? "" : " (" + topic.description() + ")"))
            .collect(Collectors.joining("\n", "\nTopics:\n", "\n"));
    }

    private String renderItem(ContentItem item) {
        String text = item.title() + "\n\n" + Objects.toString(item.body(), "");
        return text.length() > maxInputChars ? text.substring(0, maxInputChars) : text;
    }

    static String stripFences(String answer) {
        String trimmed = answer == null ? "" : answer.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closing = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) {
                return trimmed.substring(firstNewline + 1, closing).trim();
            }
        }
        return trimmed;
    }
}
