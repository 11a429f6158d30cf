package de.bsommerfeld.gamesync.launcher;

import de.bsommerfeld.gamesync.core.util.StorageUtils;
import de.bsommerfeld.gamesync.updater.model.ContentScope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lays out the launcher's writable data directory.
 *
 * <pre>
 * {appDir}/
 *   config.toml
 *   logs/
 *   keys/               signing keys (publishing hosts) or the trusted public key
 *   instances/client/   synchronized game client
 *   instances/asset/    asset index and objects
 *   instances/jvm/      bundled Java runtime
 * </pre>
 *
 * <p>
 * Each content scope syncs into its own directory, so one manifest can never
 * delete another scope's files.
 */
final class StorageResolver {

    static final String APP_NAME = "gamesync";

    private final Path appDir;

    StorageResolver(Path appDir) {
        this.appDir = appDir.toAbsolutePath();
    }

    /** The platform default location, honouring the {@code gamesync.home} override. */
    static StorageResolver platformDefault() {
        return new StorageResolver(StorageUtils.getAppDataDir(APP_NAME));
    }

    Path appDir() {
        return appDir;
    }

    Path configFile() {
        return appDir.resolve("config.toml");
    }

    Path logsDir() {
        return appDir.resolve("logs");
    }

    Path installRoot(ContentScope scope) {
        return appDir.resolve("instances").resolve(scope.wireName());
    }

    /** Like {@link #installRoot} but creates the directory first. */
    Path ensureInstallRoot(ContentScope scope) throws IOException {
        return Files.createDirectories(installRoot(scope));
    }

    /** Resolves a configured path; relative values are taken against the app directory. */
    Path resolve(String configured) {
        Path path = Path.of(configured);
        return path.isAbsolute() ? path : appDir.resolve(path);
    }
}
