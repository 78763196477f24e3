package io.tokenrelay.core;

import java.util.Optional;

/**
 * One record of the upstream generation sequence.
 *
 * @param content accumulated or chunk content (never null)
 * @param delta incremental text since the previous fragment (never null)
 * @param finishReason terminal reason such as {@code "stop"}; null while generating
 * @param usage optional usage report
 */
public record Fragment(String content, String delta, String finishReason, Usage usage) {

    public Fragment {
        content = content == null ? "" : content;
        delta = delta == null ? "" : delta;
        if (finishReason != null && finishReason.isBlank()) {
            finishReason = null;
        }
    }

    public static Fragment delta(String content, String delta) {
        return new Fragment(content, delta, null, null);
    }

    public static Fragment last(String content, String delta, String finishReason, Usage usage) {
        return new Fragment(content, delta, finishReason, usage);
    }

    /**
     * Whether this fragment ends the generation.
     */
    public boolean isTerminal() {
        return finishReason != null;
    }

    public Optional<Usage> usageIfPresent() {
        return Optional.ofNullable(usage);
    }
}
