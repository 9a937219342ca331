package com.nevis.curation.provider;

/**
 * Produces text (prose or a JSON document, depending on the task) for a structured prompt. Implementations throw
 * {@link com.nevis.curation.exception.GenerationUnavailableException} when no usable answer is available.
 */
public interface TextGenerationProvider {

    String generate(GenerationPrompt prompt);
}
