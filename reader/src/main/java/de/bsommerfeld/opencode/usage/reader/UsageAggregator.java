package de.bsommerfeld.opencode.usage.reader;

import de.bsommerfeld.opencode.usage.core.domain.TokenUsage;
import de.bsommerfeld.opencode.usage.core.domain.UsageMetrics;
import de.bsommerfeld.opencode.usage.core.domain.UsagePart;

import java.time.Clock;
import java.util.Objects;

/**
 * Folds usage parts into running totals. One instance covers exactly one
 * aggregation pass: {@link #finalizeMetrics()} consumes it.
 *
 * <p>
 * Token totals are exact {@code long} sums. The cost total is a plain
 * floating-point sum; its dependence on summation order is far below a cent
 * for realistic corpora, and token counts remain the primary metric.
 *
 * <p>
 * Not thread-safe. The reader creates a fresh aggregator per refresh.
 */
public class UsageAggregator {

    private final Clock clock;

    private long totalInputTokens;
    private long totalOutputTokens;
    private long totalReasoningTokens;
    private long totalCacheWriteTokens;
    private long totalCacheReadTokens;
    private double totalCost;
    private long totalInteractions;
    private boolean finalized;

    public UsageAggregator() {
        this(Clock.systemUTC());
    }

    public UsageAggregator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Adds one part. Parts without token data contribute nothing and are not
     * counted as an interaction.
     *
     * @throws IllegalStateException if the aggregator was already finalized
     */
    public void add(UsagePart part) {
        ensureOpen();
        TokenUsage tokens = part.tokens();
        if (tokens == null)
            return;

        totalInputTokens += tokens.input();
        totalOutputTokens += tokens.output();
        totalReasoningTokens += tokens.reasoning();
        totalCacheWriteTokens += tokens.cache().write();
        totalCacheReadTokens += tokens.cache().read();
        totalCost += part.cost();
        totalInteractions++;
    }

    public void addAll(Iterable<UsagePart> parts) {
        for (UsagePart part : parts)
            add(part);
    }

    /** Number of parts that carried tokens so far. */
    public long interactionCount() {
        return totalInteractions;
    }

    /**
     * Stamps the totals with the current instant and returns them. The
     * aggregator cannot be used afterwards.
     *
     * @throws IllegalStateException if called twice
     */
    public UsageMetrics finalizeMetrics() {
        ensureOpen();
        finalized = true;
        return new UsageMetrics(
                totalInputTokens,
                totalOutputTokens,
                totalReasoningTokens,
                totalCacheWriteTokens,
                totalCacheReadTokens,
                totalCost,
                totalInteractions,
                clock.instant());
    }

    private void ensureOpen() {
        if (finalized)
            throw new IllegalStateException("Aggregator already finalized");
    }
}
