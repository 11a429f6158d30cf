package de.bsommerfeld.gamesync.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves OS-specific application data directories following each platform's
 * native conventions. Paths are absolute but <strong>not</strong> created;
 * the caller decides whether a missing directory is an error.
 *
 * <p>
 * Resolution order per platform:
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
 * The {@code gamesync.home} system property overrides all of the above,
 * which keeps tests and portable installs out of the user's profile.
 */
public final class StorageUtils {

    public static final String HOME_OVERRIDE_PROPERTY = "gamesync.home";

    private StorageUtils() {
    }

    public static Path getAppDataDir(String appName) {
        String override = System.getProperty(HOME_OVERRIDE_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Paths.get(override).toAbsolutePath();
        }

        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(System.getProperty("user.home"), "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData != null) {
                return Paths.get(appData, appName);
            }
            return Paths.get(System.getProperty("user.home"), "AppData", "Roaming", appName);
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        if (xdgData != null && !xdgData.isEmpty()) {
            return Paths.get(xdgData, appName);
        }
        return Paths.get(System.getProperty("user.home"), ".local", "share", appName);
    }

    /** {@code {appDataDir}/logs}, kept next to the data for portability. */
    public static Path getLogsDir(String appName) {
        return getAppDataDir(appName).resolve("logs");
    }

    /** {@code {appDataDir}/config.toml}. */
    public static Path getConfigFile(String appName) {
        return getAppDataDir(appName).resolve("config.toml");
    }
}
