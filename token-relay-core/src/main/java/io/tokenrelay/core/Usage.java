package io.tokenrelay.core;

/**
 * Token usage reported by the upstream provider, usually on the final fragment.
 *
 * @param promptTokens input tokens
 * @param completionTokens output tokens
 * @param totalTokens sum reported by the provider
 */
public record Usage(long promptTokens, long completionTokens, long totalTokens) {
    public Usage {
        if (promptTokens < 0 || completionTokens < 0 || totalTokens < 0) {
            throw new IllegalArgumentException("token counts must not be negative");
        }
    }
}
