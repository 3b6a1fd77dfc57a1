package de.bsommerfeld.opencode.usage.db;

import de.bsommerfeld.opencode.usage.core.domain.UsageMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Daily usage snapshots on top of {@link DatabaseManager}.
 *
 * <p>
 * Dates are stored as ISO {@code YYYY-MM-DD} text, so lexical order is
 * chronological and range queries compare strings. {@code created_at} is an
 * RFC 3339 UTC timestamp. All SQL lives in {@code sql/*.sql}, loaded via
 * {@link SqlLoader}.
 */
public class SnapshotRepository {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotRepository.class);

    private final DatabaseManager database;
    private final Clock clock;

    public SnapshotRepository(DatabaseManager database, Clock clock) {
        this.database = Objects.requireNonNull(database, "database");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // =====================================================================
    // Writes
    // =====================================================================

    /**
     * Stores {@code metrics} as the snapshot of {@code date}, replacing an
     * existing snapshot of the same date.
     */
    public void saveSnapshot(LocalDate date, UsageMetrics metrics) throws DatabaseException {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(metrics, "metrics");
        try (DatabaseManager.ConnectionHandle handle = database.getConnection();
                PreparedStatement ps = handle.connection().prepareStatement(SqlLoader.load("upsert-snapshot"))) {
            ps.setString(1, date.toString());
            ps.setLong(2, metrics.totalInputTokens());
            ps.setLong(3, metrics.totalOutputTokens());
            ps.setLong(4, metrics.totalReasoningTokens());
            ps.setLong(5, metrics.totalCacheWriteTokens());
            ps.setLong(6, metrics.totalCacheReadTokens());
            ps.setDouble(7, metrics.totalCost());
            ps.setLong(8, metrics.totalInteractions());
            ps.setString(9, DateTimeFormatter.ISO_INSTANT.format(clock.instant()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw query("Failed to save snapshot for " + date, e);
        }
        LOG.debug("[DB] Saved snapshot for {}", date);
    }

    /**
     * Deletes snapshots dated before {@code todayUtc - retentionDays}.
     *
     * @return number of deleted rows
     * @throws IllegalArgumentException if {@code retentionDays} is negative
     */
    public int deleteOld(int retentionDays) throws DatabaseException {
        if (retentionDays < 0)
            throw new IllegalArgumentException("retentionDays must not be negative: " + retentionDays);

        LocalDate cutoff = LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(retentionDays);
        int deleted;
        try (DatabaseManager.ConnectionHandle handle = database.getConnection();
                PreparedStatement ps = handle.connection().prepareStatement(SqlLoader.load("delete-old-snapshots"))) {
            ps.setString(1, cutoff.toString());
            deleted = ps.executeUpdate();
        } catch (SQLException e) {
            throw query("Failed to delete snapshots before " + cutoff, e);
        }
        if (deleted > 0)
            LOG.info("[DB] Retention removed {} snapshot(s) older than {}.", deleted, cutoff);
        return deleted;
    }

    // =====================================================================
    // Reads
    // =====================================================================

    public Optional<UsageSnapshot> getSnapshot(LocalDate date) throws DatabaseException {
        Objects.requireNonNull(date, "date");
        try (DatabaseManager.ConnectionHandle handle = database.getConnection();
                PreparedStatement ps = handle.connection().prepareStatement(SqlLoader.load("select-snapshot"))) {
            ps.setString(1, date.toString());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw query("Failed to load snapshot for " + date, e);
        }
    }

    /**
     * Snapshots with {@code start <= date <= end}, oldest first. Empty when
     * {@code start} is after {@code end}.
     */
    public List<UsageSnapshot> getRange(LocalDate start, LocalDate end) throws DatabaseException {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        List<UsageSnapshot> snapshots = new ArrayList<>();
        try (DatabaseManager.ConnectionHandle handle = database.getConnection();
                PreparedStatement ps = handle.connection().prepareStatement(SqlLoader.load("select-snapshot-range"))) {
            ps.setString(1, start.toString());
            ps.setString(2, end.toString());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    snapshots.add(map(rs));
            }
        } catch (SQLException e) {
            throw query("Failed to load snapshots " + start + ".." + end, e);
        }
        return snapshots;
    }

    /** The snapshot with the highest date. */
    public Optional<UsageSnapshot> getLatest() throws DatabaseException {
        try (DatabaseManager.ConnectionHandle handle = database.getConnection();
                Statement stmt = handle.connection().createStatement();
                ResultSet rs = stmt.executeQuery(SqlLoader.load("select-latest-snapshot"))) {
            return rs.next() ? Optional.of(map(rs)) : Optional.empty();
        } catch (SQLException e) {
            throw query("Failed to load latest snapshot", e);
        }
    }

    /**
     * Totals over the seven days {@code weekStart .. weekStart + 6}.
     */
    public WeekSummary getWeekSummary(LocalDate weekStart) throws DatabaseException {
        Objects.requireNonNull(weekStart, "weekStart");
        return WeekSummary.of(weekStart, getRange(weekStart, weekStart.plusDays(6)));
    }

    public int count() throws DatabaseException {
        try (DatabaseManager.ConnectionHandle handle = database.getConnection();
                Statement stmt = handle.connection().createStatement();
                ResultSet rs = stmt.executeQuery(SqlLoader.load("count-snapshots"))) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw query("Failed to count snapshots", e);
        }
    }

    // =====================================================================
    // Mapping
    // =====================================================================

    private static UsageSnapshot map(ResultSet rs) throws SQLException {
        return new UsageSnapshot(
                LocalDate.parse(rs.getString("date")),
                rs.getLong("input_tokens"),
                rs.getLong("output_tokens"),
                rs.getLong("reasoning_tokens"),
                rs.getLong("cache_write_tokens"),
                rs.getLong("cache_read_tokens"),
                rs.getDouble("total_cost"),
                rs.getLong("interaction_count"),
                Instant.parse(rs.getString("created_at")));
    }

    private static DatabaseException query(String message, SQLException cause) {
        LOG.error("[DB] {}", message, cause);
        return new DatabaseException(DatabaseException.Kind.QUERY, message, cause);
    }
}
