package de.bsommerfeld.opencode.usage.db;

import de.bsommerfeld.opencode.usage.core.config.TrackerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single SQLite connection of the snapshot database.
 *
 * <h3>Lifecycle</h3>
 * The constructor creates the parent directory, opens the file, configures
 * the connection (WAL journal, foreign keys, {@code synchronous=NORMAL}) and
 * applies pending migrations. Any failure leaves no open connection behind.
 *
 * <h3>Connection strategy</h3>
 * One connection for the lifetime of the manager. Callers borrow it through
 * {@link #getConnection()}, which holds a lock until the returned handle is
 * closed, so statements from different threads never interleave. WAL mode
 * lets other processes read while this one writes.
 *
 * @see SnapshotRepository
 */
public class DatabaseManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseManager.class);

    private static final String[] PRAGMAS = {
            "PRAGMA journal_mode = WAL",
            "PRAGMA foreign_keys = ON",
            "PRAGMA synchronous = NORMAL"
    };

    private final Path path;
    private final Connection connection;
    private final ReentrantLock lock = new ReentrantLock();

    public DatabaseManager(Path path) throws DatabaseException {
        this(path, Migrations.all(), Clock.systemUTC());
    }

    DatabaseManager(Path path, List<Migration> migrations, Clock clock) throws DatabaseException {
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath();
        createParentDirectories(this.path);

        LOG.info("[DB] Opening snapshot database at {}", this.path);
        this.connection = open(this.path);
        try {
            configure(connection);
            new MigrationRunner(migrations, clock).migrate(connection);
        } catch (DatabaseException e) {
            closeQuietly(connection);
            throw e;
        }
    }

    /**
     * Opens the database at the location configured in {@code config}.
     */
    public static DatabaseManager openDefault(TrackerConfig config) throws DatabaseException {
        return new DatabaseManager(config.getDatabasePath());
    }

    /**
     * Borrows the connection exclusively. Must be closed, preferably via
     * try-with-resources, to release it for other threads.
     */
    public ConnectionHandle getConnection() {
        lock.lock();
        return new ConnectionHandle(connection, lock);
    }

    public Path path() {
        return path;
    }

    /** Applied schema version. */
    public int currentVersion() throws DatabaseException {
        try (ConnectionHandle handle = getConnection()) {
            return MigrationRunner.currentVersion(handle.connection());
        } catch (SQLException e) {
            throw new DatabaseException(DatabaseException.Kind.QUERY, "Failed to read schema version", e);
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (!connection.isClosed()) {
                connection.close();
                LOG.info("[DB] Closed snapshot database at {}", path);
            }
        } catch (SQLException e) {
            LOG.warn("[DB] Failed to close snapshot database at {}", path, e);
        } finally {
            lock.unlock();
        }
    }

    private static void createParentDirectories(Path path) throws DatabaseException {
        Path parent = path.getParent();
        if (parent == null || Files.isDirectory(parent))
            return;
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new DatabaseException(DatabaseException.Kind.IO,
                    "Failed to create database directory " + parent, e);
        }
    }

    private static Connection open(Path path) throws DatabaseException {
        try {
            return DriverManager.getConnection("jdbc:sqlite:" + path);
        } catch (SQLException e) {
            throw new DatabaseException(DatabaseException.Kind.CONNECTION,
                    "Failed to open database " + path, e);
        }
    }

    private static void configure(Connection conn) throws DatabaseException {
        try (Statement stmt = conn.createStatement()) {
            for (String pragma : PRAGMAS)
                stmt.execute(pragma);
        } catch (SQLException e) {
            throw new DatabaseException(DatabaseException.Kind.CONNECTION,
                    "Failed to configure database connection", e);
        }
    }

    private static void closeQuietly(Connection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            LOG.debug("[DB] Ignoring close failure after initialization error", e);
        }
    }

    /**
     * Exclusive lease on the shared connection. Closing the handle releases
     * the lease, not the connection.
     */
    public static final class ConnectionHandle implements AutoCloseable {

        private final Connection connection;
        private final ReentrantLock lock;
        private boolean released;

        private ConnectionHandle(Connection connection, ReentrantLock lock) {
            this.connection = connection;
            this.lock = lock;
        }

        public Connection connection() {
            if (released)
                throw new IllegalStateException("Connection handle already released");
            return connection;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                lock.unlock();
            }
        }
    }
}
