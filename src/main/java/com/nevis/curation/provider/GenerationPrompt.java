package com.nevis.curation.provider;

public record GenerationPrompt(GenerationTask task, String instructions, String input) {

    public GenerationPrompt {
        if (task == null) {
            throw new IllegalArgumentException("Generation task is required");
        }
        instructions = instructions == null ? "" : instructions;
        input = input == null ? "" : input;
    }

    public String render() {
        return instructions + "\n\nInput:\n" + input;
    }
}
