package com.nevis.curation.provider;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Offline stand-in for the chat model. Summaries are stitched from the leading sentence of each input block and
 * scoring signals are a fixed neutral assessment.
 */
public class SyntheticTextGenerationProvider implements TextGenerationProvider {

    static final String NEUTRAL_SIGNALS = """
        {
          "alignments": [{"topic": "general", "alignment": 0.5}],
          "classifications": [{"topic": "general", "confidence": 0.5}],
          "actionability": 0.5,
          "risk": 0.5,
          "stakeholder_relevance": 0.5,
          "quality": {
            "factual_density": 0.5,
            "source_authority": 0.5,
            "clarity": 0.5,
            "completeness": 0.5,
            "verification_level": 0.5
          }
        }
        """;

    private static final int MAX_SUMMARY_SENTENCES = 3;

    @Override
    public String generate(GenerationPrompt prompt) {
        return switch (prompt.task()) {
            case CLUSTER_SUMMARY -> summarize(prompt.input());
            case SCORING_SIGNALS -> NEUTRAL_SIGNALS;
        };
    }

    private String summarize(String input) {
        String summary = Arrays.stream(input.split("\\n\\s*\\n"))
            .map(String::trim)
            .filter(block -> !block.isEmpty())
            .map(SyntheticTextGenerationProvider::leadingSentence)
            .distinct()
            .limit(MAX_SUMMARY_SENTENCES)
            .collect(Collectors.joining(" "));
        return summary.isBlank() ? "No content to summarize." : summary;
    }

    private static String leadingSentence(String block) {
        int end = block.indexOf(". ");
        return end < 0 ? block : block.substring(0, end + 1);
    }
}
