package de.bsommerfeld.opencode.usage.db;

import de.bsommerfeld.opencode.usage.core.domain.UsageMetrics;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One persisted day of usage: the all-time totals as they stood when the
 * collector last ran on {@code date} (UTC).
 */
public record UsageSnapshot(
        LocalDate date,
        long inputTokens,
        long outputTokens,
        long reasoningTokens,
        long cacheWriteTokens,
        long cacheReadTokens,
        double totalCost,
        long interactionCount,
        Instant createdAt) {

    public UsageSnapshot {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public static UsageSnapshot of(LocalDate date, UsageMetrics metrics, Instant createdAt) {
        return new UsageSnapshot(
                date,
                metrics.totalInputTokens(),
                metrics.totalOutputTokens(),
                metrics.totalReasoningTokens(),
                metrics.totalCacheWriteTokens(),
                metrics.totalCacheReadTokens(),
                metrics.totalCost(),
                metrics.totalInteractions(),
                createdAt);
    }

    /** Input, output and reasoning tokens; cache traffic excluded. */
    public long totalTokens() {
        return inputTokens + outputTokens + reasoningTokens;
    }
}
