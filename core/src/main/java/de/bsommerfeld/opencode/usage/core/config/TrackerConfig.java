package de.bsommerfeld.opencode.usage.core.config;

import de.bsommerfeld.opencode.usage.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;

/**
 * Runtime parameters of the usage pipeline. Defaults match the standard
 * OpenCode installation; the settings UI owns persistence of user overrides
 * and hands them in through the setters.
 *
 * <p>
 * Each value can also be overridden at startup via a system property or the
 * matching environment variable, see {@link #fromEnvironment()}.
 */
public class TrackerConfig {

    private static final Logger LOG = LoggerFactory.getLogger(TrackerConfig.class);

    static final String STORAGE_PATH_PROPERTY = "usage.storage.path";
    static final String DATABASE_PATH_PROPERTY = "usage.db.path";
    static final String CACHE_TTL_PROPERTY = "usage.cache.ttl-seconds";
    static final String RETENTION_PROPERTY = "usage.retention-days";

    /** How long the reader serves all-time metrics without rescanning. */
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);

    /** Snapshots older than this many days are eligible for cleanup. */
    public static final int DEFAULT_RETENTION_DAYS = 365;

    private Path storagePath = StorageUtils.getOpenCodePartDir();
    private Path databasePath = StorageUtils.getDefaultDatabasePath();
    private Duration cacheTtl = DEFAULT_CACHE_TTL;
    private int retentionDays = DEFAULT_RETENTION_DAYS;

    /**
     * Builds a config from defaults, then applies overrides from system
     * properties ({@code usage.storage.path}, {@code usage.db.path},
     * {@code usage.cache.ttl-seconds}, {@code usage.retention-days}) or their
     * environment variable form ({@code USAGE_STORAGE_PATH}, ...). Invalid
     * numeric overrides are logged and ignored.
     */
    public static TrackerConfig fromEnvironment() {
        TrackerConfig config = new TrackerConfig();

        String storage = lookup(STORAGE_PATH_PROPERTY);
        if (storage != null) {
            config.setStoragePath(Paths.get(storage));
        }
        String database = lookup(DATABASE_PATH_PROPERTY);
        if (database != null) {
            config.setDatabasePath(Paths.get(database));
        }
        String ttl = lookup(CACHE_TTL_PROPERTY);
        if (ttl != null) {
            try {
                config.setCacheTtl(Duration.ofSeconds(Long.parseLong(ttl.trim())));
            } catch (IllegalArgumentException e) {
                LOG.warn("Ignoring invalid cache TTL '{}': {}", ttl, e.getMessage());
            }
        }
        String retention = lookup(RETENTION_PROPERTY);
        if (retention != null) {
            try {
                config.setRetentionDays(Integer.parseInt(retention.trim()));
            } catch (IllegalArgumentException e) {
                LOG.warn("Ignoring invalid retention '{}': {}", retention, e.getMessage());
            }
        }
        return config;
    }

    /**
     * System property first, then the environment variable derived from the
     * property name ({@code usage.db.path} becomes {@code USAGE_DB_PATH}).
     */
    static String lookup(String property) {
        String value = System.getProperty(property);
        if (value == null || value.isEmpty()) {
            value = System.getenv(property.toUpperCase().replace('.', '_').replace('-', '_'));
        }
        return (value == null || value.isEmpty()) ? null : value;
    }

    public Path getStoragePath() {
        return storagePath;
    }

    public void setStoragePath(Path storagePath) {
        this.storagePath = Objects.requireNonNull(storagePath, "storagePath");
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    public void setDatabasePath(Path databasePath) {
        this.databasePath = Objects.requireNonNull(databasePath, "databasePath");
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        if (cacheTtl == null || cacheTtl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be zero or positive: " + cacheTtl);
        }
        this.cacheTtl = cacheTtl;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
        if (retentionDays < 0) {
            throw new IllegalArgumentException("Retention must not be negative: " + retentionDays);
        }
        this.retentionDays = retentionDays;
    }

    @Override
    public String toString() {
        return "TrackerConfig{storagePath=" + storagePath
                + ", databasePath=" + databasePath
                + ", cacheTtl=" + cacheTtl
                + ", retentionDays=" + retentionDays + '}';
    }
}
