package de.bsommerfeld.opencode.usage.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Brings a connection's schema up to the newest {@link Migration}.
 *
 * <h3>Versioning</h3>
 * The applied version is {@code MAX(version)} in {@code schema_version}, or
 * 0 while that table does not exist yet. Migrations at or below it are
 * skipped, so running against an up-to-date database is a no-op.
 *
 * <h3>Transaction boundaries</h3>
 * Each migration runs in its own transaction together with its
 * {@code schema_version} row. A failing migration is rolled back; migrations
 * committed before it stay applied.
 */
public class MigrationRunner {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationRunner.class);

    private final List<Migration> migrations;
    private final Clock clock;

    public MigrationRunner(List<Migration> migrations, Clock clock) {
        List<Migration> sorted = new ArrayList<>(migrations);
        sorted.sort(Comparator.comparingInt(Migration::version));
        this.migrations = List.copyOf(sorted);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Applies every pending migration.
     *
     * @return the number of migrations applied
     * @throws DatabaseException {@link DatabaseException.Kind#MIGRATION} if a
     *                           migration fails
     */
    public int migrate(Connection conn) throws DatabaseException {
        int current;
        try {
            current = currentVersion(conn);
        } catch (SQLException e) {
            throw new DatabaseException(DatabaseException.Kind.MIGRATION,
                    "Failed to read schema version", e);
        }

        int applied = 0;
        for (Migration migration : migrations) {
            if (migration.version() <= current)
                continue;
            apply(conn, migration);
            current = migration.version();
            applied++;
        }

        if (applied > 0) {
            LOG.info("[DB] Applied {} migration(s), schema is at version {}.", applied, current);
        } else {
            LOG.debug("[DB] Schema is up to date at version {}.", current);
        }
        return applied;
    }

    /**
     * Returns the applied schema version, 0 for a fresh database.
     */
    public static int currentVersion(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(SqlLoader.load("check-schema-version-table"))) {
            if (!rs.next() || rs.getInt(1) == 0)
                return 0;
        }
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(SqlLoader.load("select-schema-version"))) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private void apply(Connection conn, Migration migration) throws DatabaseException {
        LOG.info("[DB] Applying migration {}: {}", migration.version(), migration.description());
        try {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                for (String sql : migration.statements())
                    stmt.execute(sql);
                recordVersion(conn, migration.version());
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new DatabaseException(DatabaseException.Kind.MIGRATION,
                    "Migration " + migration.version() + " (" + migration.description() + ") failed", e);
        }
    }

    private void recordVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-schema-version"))) {
            ps.setInt(1, version);
            ps.setString(2, DateTimeFormatter.ISO_INSTANT.format(clock.instant()));
            ps.executeUpdate();
        }
    }
}
