package de.bsommerfeld.opencode.usage.db;

import java.time.LocalDate;
import java.util.List;

/**
 * Sums over the snapshots of the seven days starting at {@code weekStart}.
 * {@code daysRecorded} counts the days that actually have a snapshot.
 */
public record WeekSummary(
        LocalDate weekStart,
        LocalDate weekEnd,
        long inputTokens,
        long outputTokens,
        long reasoningTokens,
        long cacheWriteTokens,
        long cacheReadTokens,
        double totalCost,
        long interactionCount,
        int daysRecorded) {

    static WeekSummary of(LocalDate weekStart, List<UsageSnapshot> snapshots) {
        long input = 0;
        long output = 0;
        long reasoning = 0;
        long cacheWrite = 0;
        long cacheRead = 0;
        double cost = 0.0;
        long interactions = 0;
        for (UsageSnapshot s : snapshots) {
            input += s.inputTokens();
            output += s.outputTokens();
            reasoning += s.reasoningTokens();
            cacheWrite += s.cacheWriteTokens();
            cacheRead += s.cacheReadTokens();
            cost += s.totalCost();
            interactions += s.interactionCount();
        }
        return new WeekSummary(weekStart, weekStart.plusDays(6), input, output, reasoning,
                cacheWrite, cacheRead, cost, interactions, snapshots.size());
    }

    public long totalTokens() {
        return inputTokens + outputTokens + reasoningTokens;
    }
}
