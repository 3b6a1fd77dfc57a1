package de.bsommerfeld.opencode.usage.app;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.opencode.usage.collector.DataCollector;
import de.bsommerfeld.opencode.usage.core.config.TrackerConfig;
import de.bsommerfeld.opencode.usage.core.event.ApplicationEventBus;
import de.bsommerfeld.opencode.usage.core.event.UsageEvents.PersistenceUnavailableEvent;
import de.bsommerfeld.opencode.usage.db.DatabaseException;
import de.bsommerfeld.opencode.usage.db.DatabaseManager;
import de.bsommerfeld.opencode.usage.db.SnapshotRepository;
import de.bsommerfeld.opencode.usage.reader.StorageScanner;
import de.bsommerfeld.opencode.usage.reader.UsageParser;
import de.bsommerfeld.opencode.usage.reader.UsageReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Guice module wiring the usage pipeline.
 *
 * <p>
 * Persistence is optional: if the snapshot database cannot be opened the
 * failure is logged, a {@link PersistenceUnavailableEvent} is posted and the
 * repository and collector bindings resolve to {@link Optional#empty()}. Live
 * metrics keep working.
 */
public class UsageModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(UsageModule.class);

    private final TrackerConfig config;
    private final Clock clock;

    public UsageModule() {
        this(TrackerConfig.fromEnvironment(), Clock.systemDefaultZone());
    }

    public UsageModule(TrackerConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    protected void configure() {
        LOG.info("Configuring usage pipeline: {}", config);
        bind(TrackerConfig.class).toInstance(config);
        bind(Clock.class).toInstance(clock);
    }

    @Provides
    @Singleton
    StorageScanner provideScanner(TrackerConfig config) {
        return new StorageScanner(config.getStoragePath());
    }

    @Provides
    @Singleton
    UsageReader provideReader(StorageScanner scanner, UsageParser parser, Clock clock, TrackerConfig config) {
        return new UsageReader(scanner, parser, clock, config.getCacheTtl());
    }

    @Provides
    @Singleton
    Optional<DatabaseManager> provideDatabase(TrackerConfig config, ApplicationEventBus eventBus) {
        try {
            return Optional.of(DatabaseManager.openDefault(config));
        } catch (DatabaseException e) {
            LOG.error("Snapshot database unavailable ({}), continuing without history", e.getKind(), e);
            eventBus.post(new PersistenceUnavailableEvent(e.getMessage()));
            return Optional.empty();
        }
    }

    @Provides
    @Singleton
    Optional<SnapshotRepository> provideRepository(Optional<DatabaseManager> database, Clock clock) {
        return database.map(db -> new SnapshotRepository(db, clock));
    }

    @Provides
    @Singleton
    Optional<DataCollector> provideCollector(Optional<SnapshotRepository> repository, Clock clock,
            ApplicationEventBus eventBus) {
        return repository.map(repo -> new DataCollector(repo, clock, eventBus));
    }
}
