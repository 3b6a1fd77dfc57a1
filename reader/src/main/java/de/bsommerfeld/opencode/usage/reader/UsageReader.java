package de.bsommerfeld.opencode.usage.reader;

import de.bsommerfeld.opencode.usage.core.config.TrackerConfig;
import de.bsommerfeld.opencode.usage.core.domain.DisplayMode;
import de.bsommerfeld.opencode.usage.core.domain.UsageMetrics;
import de.bsommerfeld.opencode.usage.core.domain.UsagePart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Scanner, parser and aggregator composed into the single read path the UI
 * polls on every tick.
 *
 * <h3>Caching</h3>
 * All-time metrics are cached for {@code cacheTtl} (five minutes by
 * default). Within the window {@link #getUsage()} returns the very same
 * {@link UsageMetrics} instance without touching the filesystem. Once the
 * window has elapsed the totals are recomputed from scratch over whatever is
 * on disk now; nothing is carried over from the previous value.
 *
 * <h3>Parse memo</h3>
 * Parsing dominates refresh cost, and part files are written once and then
 * left alone. Each parsed file is therefore remembered together with its
 * modification time, and an unchanged file is not read again on the next
 * refresh. Malformed files are not remembered so a part caught mid-write is
 * picked up once complete. The memo only saves I/O; totals are always
 * re-summed over the current file set.
 *
 * <h3>Period views</h3>
 * {@link #getUsageToday()}, {@link #getUsageThisMonth()} and
 * {@link #getUsageLastMonth()} filter by file modification time in the
 * clock's zone. They are not cached but share the parse memo. Every view
 * walks the whole storage root, so memo entries of deleted files are dropped
 * whichever view runs.
 *
 * <h3>Threading</h3>
 * One lock guards cache and memo. Concurrent callers serialize, so a burst of
 * UI ticks after expiry triggers a single scan.
 */
public class UsageReader {

    private static final Logger LOG = LoggerFactory.getLogger(UsageReader.class);

    private final StorageScanner scanner;
    private final UsageParser parser;
    private final Clock clock;
    private final Duration cacheTtl;

    private final ReentrantLock lock = new ReentrantLock();
    private CachedMetrics cached;
    private final Map<Path, MemoEntry> memo = new HashMap<>();

    public UsageReader(StorageScanner scanner, UsageParser parser) {
        this(scanner, parser, Clock.systemDefaultZone(), TrackerConfig.DEFAULT_CACHE_TTL);
    }

    public UsageReader(StorageScanner scanner, UsageParser parser, Clock clock, Duration cacheTtl) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.cacheTtl = Objects.requireNonNull(cacheTtl, "cacheTtl");
    }

    public Path storageRoot() {
        return scanner.getRoot();
    }

    /**
     * Returns all-time metrics, from cache when fresh.
     *
     * @throws ReaderException {@link ReaderException.Kind#SCAN} if the storage
     *                         root is missing or unreadable,
     *                         {@link ReaderException.Kind#NO_DATA} if no file
     *                         carries token data
     */
    public UsageMetrics getUsage() throws ReaderException {
        lock.lock();
        try {
            if (cached != null && isFresh(cached)) {
                LOG.debug("Serving cached usage metrics from {}", cached.cachedAt());
                return cached.metrics();
            }

            List<ScannedFile> files = scanAll();
            pruneMemo(files);
            UsageMetrics metrics = aggregate(files);
            cached = new CachedMetrics(metrics, metrics.lastUpdated());
            return metrics;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Dispatches to the all-time or period view for {@code mode}.
     */
    public UsageMetrics getUsage(DisplayMode mode) throws ReaderException {
        switch (mode) {
            case TODAY:
                return getUsageToday();
            case MONTH:
                return getUsageThisMonth();
            case LAST_MONTH:
                return getUsageLastMonth();
            case ALL_TIME:
            default:
                return getUsage();
        }
    }

    /** Metrics of files modified since local midnight. */
    public UsageMetrics getUsageToday() throws ReaderException {
        return getUsageBetween(startOf(today()), null);
    }

    /** Metrics of files modified since the first day of this month. */
    public UsageMetrics getUsageThisMonth() throws ReaderException {
        return getUsageBetween(startOf(today().withDayOfMonth(1)), null);
    }

    /** Metrics of files modified during the previous calendar month. */
    public UsageMetrics getUsageLastMonth() throws ReaderException {
        LocalDate firstOfMonth = today().withDayOfMonth(1);
        return getUsageBetween(startOf(firstOfMonth.minusMonths(1)), startOf(firstOfMonth));
    }

    /**
     * Drops the cached all-time value so the next {@link #getUsage()} rescans.
     * The parse memo is kept.
     */
    public void invalidate() {
        lock.lock();
        try {
            cached = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Aggregates files modified in {@code [from, until)}; an open end when
     * {@code until} is {@code null}.
     */
    private UsageMetrics getUsageBetween(Instant from, Instant until) throws ReaderException {
        lock.lock();
        try {
            List<ScannedFile> all = scanAll();
            pruneMemo(all);

            List<ScannedFile> window = new ArrayList<>();
            for (ScannedFile file : all) {
                Instant modified = file.lastModified();
                if (!modified.isBefore(from) && (until == null || modified.isBefore(until)))
                    window.add(file);
            }
            return aggregate(window);
        } finally {
            lock.unlock();
        }
    }

    private List<ScannedFile> scanAll() throws ReaderException {
        try {
            return scanner.scanWithMetadata();
        } catch (ScanException e) {
            LOG.error("Failed to scan storage directory {}", scanner.getRoot(), e);
            throw new ReaderException(e);
        }
    }

    /** Drops memo entries of files no longer on disk. Called with the lock held. */
    private void pruneMemo(List<ScannedFile> onDisk) {
        Set<Path> present = new HashSet<>(onDisk.size() * 2);
        for (ScannedFile file : onDisk)
            present.add(file.path());
        memo.keySet().retainAll(present);
    }

    /**
     * Parses (or recalls) every file and sums the relevant parts. Called with
     * the lock held.
     */
    private UsageMetrics aggregate(List<ScannedFile> files) throws ReaderException {
        if (files.isEmpty()) {
            throw new ReaderException(ReaderException.Kind.NO_DATA,
                    "No usage data found in " + scanner.getRoot());
        }

        UsageAggregator aggregator = new UsageAggregator(clock);
        int parsed = 0;
        int reused = 0;
        int malformed = 0;

        for (ScannedFile file : files) {
            MemoEntry entry = memo.get(file.path());
            if (entry != null && entry.lastModified().equals(file.lastModified())) {
                reused++;
            } else {
                parsed++;
                ParseOutcome outcome = parser.classify(file.path());
                if (outcome.status() == ParseOutcome.Status.MALFORMED) {
                    malformed++;
                    memo.remove(file.path());
                    LOG.debug("Skipping malformed part file {}: {}", file.path(), outcome.error().getMessage());
                    continue;
                }
                entry = new MemoEntry(file.lastModified(), outcome.part());
                memo.put(file.path(), entry);
            }

            if (entry.part() != null)
                aggregator.add(entry.part());
        }

        LOG.info("Aggregated {} part files ({} parsed, {} reused, {} malformed), {} interactions.",
                files.size(), parsed, reused, malformed, aggregator.interactionCount());

        if (aggregator.interactionCount() == 0) {
            throw new ReaderException(ReaderException.Kind.NO_DATA,
                    "No usage data found in " + scanner.getRoot());
        }
        return aggregator.finalizeMetrics();
    }

    int memoSize() {
        lock.lock();
        try {
            return memo.size();
        } finally {
            lock.unlock();
        }
    }

    private boolean isFresh(CachedMetrics entry) {
        return Duration.between(entry.cachedAt(), clock.instant()).compareTo(cacheTtl) < 0;
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private Instant startOf(LocalDate date) {
        ZoneId zone = clock.getZone();
        return date.atStartOfDay(zone).toInstant();
    }

    /** Last all-time result and the instant it was computed. */
    private record CachedMetrics(UsageMetrics metrics, Instant cachedAt) {
    }

    /** Parse result of one file; {@code part} is {@code null} for irrelevant files. */
    private record MemoEntry(Instant lastModified, UsagePart part) {
    }
}
