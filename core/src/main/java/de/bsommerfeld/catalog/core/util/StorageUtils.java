package de.bsommerfeld.catalog.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves where the catalog keeps its configuration and SQLite file.
 * Paths are returned absolute but are <strong>not</strong> created; the
 * caller is responsible for ensuring the directory exists.
 *
 * <ul>
 * <li><strong>macOS</strong>:
 * {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "catalog";
    public static final String CONFIG_FILE = "config.toml";

    private StorageUtils() {
    }

    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        String home = System.getProperty("user.home");

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(home, "Library", "Application Support", appName).toAbsolutePath();
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return (appData != null ? Paths.get(appData, appName)
                    : Paths.get(home, "AppData", "Roaming", appName)).toAbsolutePath();
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        return (xdgData != null && !xdgData.isEmpty() ? Paths.get(xdgData, appName)
                : Paths.get(home, ".local", "share", appName)).toAbsolutePath();
    }

    /**
     * Returns {@code {appDataDir}/config.toml} for the catalog.
     */
    public static Path getConfigFile() {
        return getAppDataDir(APP_NAME).resolve(CONFIG_FILE);
    }

    /**
     * Resolves the configured database file. Absolute names are kept as they
     * are, relative names land in the application data directory.
     *
     * @throws IllegalArgumentException for a {@code null} or blank name
     */
    public static Path resolveDatabaseFile(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("Database file name must not be blank");
        }
        Path file = Paths.get(fileName);
        return file.isAbsolute() ? file : getAppDataDir(APP_NAME).resolve(file);
    }
}
