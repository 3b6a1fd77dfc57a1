package de.bsommerfeld.opencode.usage.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Cumulative token usage over a set of usage parts. Produced once per
 * aggregation pass and never mutated afterwards; the reader hands out the
 * same instance for as long as it is cached.
 *
 * @param totalInputTokens      sum of all input tokens
 * @param totalOutputTokens     sum of all output tokens
 * @param totalReasoningTokens  sum of all reasoning tokens
 * @param totalCacheWriteTokens sum of all cache write tokens
 * @param totalCacheReadTokens  sum of all cache read tokens
 * @param totalCost             sum of all step costs in USD
 * @param totalInteractions     number of parts that carried token data
 * @param lastUpdated           instant the aggregation was finalized
 */
public record UsageMetrics(
        long totalInputTokens,
        long totalOutputTokens,
        long totalReasoningTokens,
        long totalCacheWriteTokens,
        long totalCacheReadTokens,
        double totalCost,
        long totalInteractions,
        Instant lastUpdated) {

    public UsageMetrics {
        Objects.requireNonNull(lastUpdated, "lastUpdated");
    }

    /**
     * Metrics with every counter at zero, e.g. for a day without activity.
     */
    public static UsageMetrics empty(Instant at) {
        return new UsageMetrics(0, 0, 0, 0, 0, 0.0, 0, at);
    }

    /**
     * Input + output + reasoning. Cache tokens are a subset of the prompt and
     * are reported separately.
     */
    public long totalTokens() {
        return totalInputTokens + totalOutputTokens + totalReasoningTokens;
    }
}
