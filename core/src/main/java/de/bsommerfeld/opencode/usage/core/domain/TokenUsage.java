package de.bsommerfeld.opencode.usage.core.domain;

/**
 * Token counts of one finished step. All counts are non-negative.
 *
 * @param input     prompt tokens sent to the model
 * @param output    completion tokens produced by the model
 * @param reasoning tokens spent on hidden reasoning
 * @param cache     prompt-cache reads and writes, never {@code null}
 */
public record TokenUsage(long input, long output, long reasoning, CacheUsage cache) {

    /**
     * Canonical constructor. A missing cache block counts as zero cache usage.
     */
    public TokenUsage {
        cache = cache != null ? cache : CacheUsage.NONE;
    }
}
