package de.bsommerfeld.opencode.usage.collector;

import de.bsommerfeld.opencode.usage.core.domain.UsageMetrics;
import de.bsommerfeld.opencode.usage.core.event.ApplicationEventBus;
import de.bsommerfeld.opencode.usage.core.event.UsageEvents.SnapshotCollectedEvent;
import de.bsommerfeld.opencode.usage.db.DatabaseException;
import de.bsommerfeld.opencode.usage.db.SnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writes at most one snapshot per UTC day.
 *
 * <p>
 * The UI offers every freshly fetched {@link UsageMetrics}; the collector
 * keeps the date of its last successful save and only hits the database when
 * the UTC date has moved on. Reading the marker, saving and advancing the
 * marker form one critical section, so concurrent offers on the same day
 * produce a single write.
 *
 * <p>
 * The marker lives in memory. After a restart the first offer of the day
 * writes again, which overwrites the same date row.
 */
public class DataCollector {

    private static final Logger LOG = LoggerFactory.getLogger(DataCollector.class);

    static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

    private final SnapshotRepository repository;
    private final Clock clock;
    private final ApplicationEventBus eventBus;
    private final Duration lockTimeout;

    private final ReentrantLock lock = new ReentrantLock();
    private LocalDate lastCollectionDate;

    public DataCollector(SnapshotRepository repository, Clock clock, ApplicationEventBus eventBus) {
        this(repository, clock, eventBus, DEFAULT_LOCK_TIMEOUT);
    }

    DataCollector(SnapshotRepository repository, Clock clock, ApplicationEventBus eventBus, Duration lockTimeout) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
    }

    /**
     * Saves {@code metrics} as today's snapshot unless one was already saved
     * today.
     *
     * @return {@code true} if a snapshot was written
     * @throws CollectorException {@link CollectorException.Kind#DATABASE} if
     *                            the save failed (the next call retries),
     *                            {@link CollectorException.Kind#LOCK} if the
     *                            marker could not be locked
     */
    public boolean collectAndSave(UsageMetrics metrics) throws CollectorException {
        Objects.requireNonNull(metrics, "metrics");
        LocalDate today;
        acquire();
        try {
            today = todayUtc();
            if (today.equals(lastCollectionDate)) {
                LOG.trace("Snapshot for {} already collected", today);
                return false;
            }

            try {
                repository.saveSnapshot(today, metrics);
            } catch (DatabaseException e) {
                LOG.warn("Failed to save snapshot for {}, will retry on next fetch", today, e);
                throw new CollectorException(e);
            }
            lastCollectionDate = today;
            LOG.info("Collected usage snapshot for {} ({} interactions).", today, metrics.totalInteractions());
        } finally {
            lock.unlock();
        }

        eventBus.post(new SnapshotCollectedEvent(today, metrics));
        return true;
    }

    /**
     * Whether {@link #collectAndSave} would write right now. Answers
     * {@code true} when the marker is busy, letting the caller attempt it.
     */
    public boolean shouldCollect() {
        if (!lock.tryLock())
            return true;
        try {
            return !todayUtc().equals(lastCollectionDate);
        } finally {
            lock.unlock();
        }
    }

    /** Date of the last successful save, if any since startup. */
    public Optional<LocalDate> lastCollectionDate() {
        lock.lock();
        try {
            return Optional.ofNullable(lastCollectionDate);
        } finally {
            lock.unlock();
        }
    }

    private void acquire() throws CollectorException {
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS))
                throw new CollectorException("Timed out after " + lockTimeout + " waiting for collector lock");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollectorException("Interrupted while waiting for collector lock", e);
        }
    }

    private LocalDate todayUtc() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }
}
