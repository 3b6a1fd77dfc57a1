package de.bsommerfeld.opencode.usage.core.event;

import de.bsommerfeld.opencode.usage.core.domain.DisplayMode;
import de.bsommerfeld.opencode.usage.core.domain.UsageMetrics;

import java.time.LocalDate;

/**
 * Events posted by the pipeline on the {@link ApplicationEventBus}. Only
 * events the UI layer consumes belong here.
 */
public class UsageEvents {

    /**
     * Fired after every successful fetch cycle with the metrics that were
     * handed to the UI.
     */
    public record UsageRefreshedEvent(DisplayMode mode, UsageMetrics metrics) {
    }

    /**
     * Fired when the collector wrote the daily snapshot for {@code date}.
     */
    public record SnapshotCollectedEvent(LocalDate date, UsageMetrics metrics) {
    }

    /**
     * Fired once when the snapshot database could not be opened. The tracker
     * keeps serving live metrics, history views should show their empty state.
     */
    public record PersistenceUnavailableEvent(String reason) {
    }
}
