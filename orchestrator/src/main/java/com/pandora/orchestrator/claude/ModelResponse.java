package com.pandora.orchestrator.claude;

/**
 * Text answer of a model call plus token accounting.
 */
public record ModelResponse(String text, long inputTokens, long outputTokens) {

    public long totalTokens() {
        return inputTokens + outputTokens;
    }
}
