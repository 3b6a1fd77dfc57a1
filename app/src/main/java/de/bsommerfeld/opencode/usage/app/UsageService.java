package de.bsommerfeld.opencode.usage.app;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.opencode.usage.collector.CollectorException;
import de.bsommerfeld.opencode.usage.collector.DataCollector;
import de.bsommerfeld.opencode.usage.core.config.TrackerConfig;
import de.bsommerfeld.opencode.usage.core.domain.DisplayMode;
import de.bsommerfeld.opencode.usage.core.domain.UsageMetrics;
import de.bsommerfeld.opencode.usage.core.event.ApplicationEventBus;
import de.bsommerfeld.opencode.usage.core.event.UsageEvents.UsageRefreshedEvent;
import de.bsommerfeld.opencode.usage.db.DatabaseException;
import de.bsommerfeld.opencode.usage.db.SnapshotRepository;
import de.bsommerfeld.opencode.usage.db.UsageSnapshot;
import de.bsommerfeld.opencode.usage.reader.ReaderException;
import de.bsommerfeld.opencode.usage.reader.UsageReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for the presentation layer. One {@link #fetch(DisplayMode)}
 * per UI tick reads metrics, lets the collector snapshot them and notifies
 * listeners.
 */
@Singleton
public class UsageService {

    private static final Logger LOG = LoggerFactory.getLogger(UsageService.class);

    private final UsageReader reader;
    private final Optional<DataCollector> collector;
    private final Optional<SnapshotRepository> repository;
    private final ApplicationEventBus eventBus;
    private final TrackerConfig config;

    @Inject
    public UsageService(UsageReader reader, Optional<DataCollector> collector,
            Optional<SnapshotRepository> repository, ApplicationEventBus eventBus, TrackerConfig config) {
        this.reader = reader;
        this.collector = collector;
        this.repository = repository;
        this.eventBus = eventBus;
        this.config = config;
    }

    /**
     * Reads metrics for {@code mode}. Snapshotting is best effort: collector
     * failures are logged and never fail the fetch.
     */
    public UsageMetrics fetch(DisplayMode mode) throws ReaderException {
        UsageMetrics metrics = reader.getUsage(mode);

        if (collector.isPresent()) {
            try {
                collector.get().collectAndSave(metrics);
            } catch (CollectorException e) {
                LOG.warn("Snapshot collection failed ({}): {}", e.getKind(), e.getMessage());
            }
        }

        eventBus.post(new UsageRefreshedEvent(mode, metrics));
        return metrics;
    }

    public boolean persistenceAvailable() {
        return repository.isPresent();
    }

    /**
     * Snapshots between {@code start} and {@code end} inclusive, oldest
     * first. Empty without persistence.
     */
    public List<UsageSnapshot> history(LocalDate start, LocalDate end) throws DatabaseException {
        if (repository.isEmpty())
            return Collections.emptyList();
        return repository.get().getRange(start, end);
    }

    /**
     * Deletes snapshots beyond the configured retention.
     *
     * @return deleted row count, 0 without persistence
     */
    public int applyRetention() throws DatabaseException {
        if (repository.isEmpty())
            return 0;
        return repository.get().deleteOld(config.getRetentionDays());
    }
}
