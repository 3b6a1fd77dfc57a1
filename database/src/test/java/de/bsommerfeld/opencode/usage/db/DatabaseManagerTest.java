package de.bsommerfeld.opencode.usage.db;

import de.bsommerfeld.opencode.usage.core.config.TrackerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseManagerTest {

    @TempDir
    Path tempDir;

    @Test
    void constructor_shouldCreateParentDirectoriesAndMigrate() throws Exception {
        Path file = tempDir.resolve("nested/dir/usage.db");

        try (DatabaseManager db = new DatabaseManager(file)) {
            assertTrue(Files.exists(file));
            assertEquals(file.toAbsolutePath(), db.path());
            assertEquals(Migrations.latestVersion(), db.currentVersion());
        }
    }

    @Test
    void constructor_shouldEnableWalJournal() throws Exception {
        try (DatabaseManager db = new DatabaseManager(tempDir.resolve("usage.db"));
                DatabaseManager.ConnectionHandle handle = db.getConnection();
                Statement stmt = handle.connection().createStatement();
                ResultSet rs = stmt.executeQuery("PRAGMA journal_mode")) {
            assertTrue(rs.next());
            assertEquals("wal", rs.getString(1).toLowerCase());
        }
    }

    @Test
    void constructor_shouldBeIdempotentAcrossReopen() throws Exception {
        Path file = tempDir.resolve("usage.db");
        new DatabaseManager(file).close();

        try (DatabaseManager db = new DatabaseManager(file)) {
            assertEquals(Migrations.latestVersion(), db.currentVersion());
        }
    }

    @Test
    void constructor_shouldFailWithIoWhenParentIsAFile() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");

        DatabaseException e = assertThrows(DatabaseException.class,
                () -> new DatabaseManager(blocker.resolve("usage.db")));

        assertEquals(DatabaseException.Kind.IO, e.getKind());
    }

    @Test
    void openDefault_shouldUseConfiguredPath() throws Exception {
        TrackerConfig config = new TrackerConfig();
        config.setDatabasePath(tempDir.resolve("configured.db"));

        try (DatabaseManager db = DatabaseManager.openDefault(config)) {
            assertEquals(tempDir.resolve("configured.db").toAbsolutePath(), db.path());
        }
    }

    @Test
    void getConnection_shouldBlockOtherThreadsUntilHandleIsClosed() throws Exception {
        try (DatabaseManager db = new DatabaseManager(tempDir.resolve("usage.db"))) {
            CountDownLatch acquired = new CountDownLatch(1);
            AtomicBoolean otherGotIt = new AtomicBoolean();

            Thread other;
            try (DatabaseManager.ConnectionHandle handle = db.getConnection()) {
                other = new Thread(() -> {
                    try (DatabaseManager.ConnectionHandle second = db.getConnection()) {
                        otherGotIt.set(true);
                        acquired.countDown();
                    }
                });
                other.start();
                assertFalse(acquired.await(200, TimeUnit.MILLISECONDS));
                assertFalse(otherGotIt.get());
            }

            assertTrue(acquired.await(5, TimeUnit.SECONDS));
            other.join();
        }
    }

    @Test
    void connectionHandle_shouldRejectUseAfterClose() throws Exception {
        try (DatabaseManager db = new DatabaseManager(tempDir.resolve("usage.db"))) {
            DatabaseManager.ConnectionHandle handle = db.getConnection();
            handle.close();
            handle.close();

            assertThrows(IllegalStateException.class, handle::connection);
        }
    }
}
