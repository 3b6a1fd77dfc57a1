package de.bsommerfeld.opencode.usage.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves the two on-disk locations the tracker works with: its own
 * application data directory (where the snapshot database lives) and the
 * OpenCode storage directory (where the usage part files are read from).
 * Paths are returned as absolute {@link Path} instances but are
 * <strong>not</strong> created.
 *
 * <p>
 * Application data directory per platform:
 * <ul>
 * <li><strong>macOS</strong>:
 * {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 *
 * <p>
 * OpenCode itself follows the XDG layout on every platform, so its part
 * directory is always resolved below the XDG data home.
 */
public final class StorageUtils {

    /** Directory name of this application below the platform data dir. */
    public static final String APP_NAME = "opencode-usage";

    private StorageUtils() {
    }

    /**
     * Returns the platform-specific application data directory for the given
     * app name. The directory is not guaranteed to exist.
     *
     * @param appName application identifier used as the directory name
     * @return absolute path to the application's data directory
     */
    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        Path path;

        if ((os.contains("mac")) || (os.contains("darwin"))) {
            path = Paths.get(System.getProperty("user.home"), "Library", "Application Support", appName);
        } else if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData != null) {
                path = Paths.get(appData, appName);
            } else {
                path = Paths.get(System.getProperty("user.home"), "AppData", "Roaming", appName);
            }
        } else {
            path = getXdgDataHome().resolve(appName);
        }
        return path.toAbsolutePath();
    }

    /**
     * Default location of the snapshot database:
     * {@code {appDataDir}/usage.db}.
     */
    public static Path getDefaultDatabasePath() {
        return getAppDataDir(APP_NAME).resolve("usage.db");
    }

    /**
     * Default location of OpenCode's usage part files:
     * {@code $XDG_DATA_HOME/opencode/storage/part}.
     */
    public static Path getOpenCodePartDir() {
        return getXdgDataHome().resolve("opencode").resolve("storage").resolve("part");
    }

    /**
     * {@code $XDG_DATA_HOME} if set and non-empty, otherwise
     * {@code ~/.local/share}.
     */
    static Path getXdgDataHome() {
        String xdgData = System.getenv("XDG_DATA_HOME");
        if (xdgData != null && !xdgData.isEmpty()) {
            return Paths.get(xdgData).toAbsolutePath();
        }
        return Paths.get(System.getProperty("user.home"), ".local", "share").toAbsolutePath();
    }
}
