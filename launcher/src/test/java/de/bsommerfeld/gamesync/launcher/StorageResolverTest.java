package de.bsommerfeld.gamesync.launcher;

import de.bsommerfeld.gamesync.updater.model.ContentScope;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageResolverTest {

    @TempDir
    Path appDir;

    @Test
    void installRoot_shouldSeparateScopes() {
        StorageResolver storage = new StorageResolver(appDir);

        assertEquals(appDir.resolve("instances/client"), storage.installRoot(ContentScope.CLIENT));
        assertEquals(appDir.resolve("instances/asset"), storage.installRoot(ContentScope.ASSET_INDEX));
        assertEquals(appDir.resolve("instances/jvm"), storage.installRoot(ContentScope.RUNTIME));
    }

    @Test
    void ensureInstallRoot_shouldCreateDirectory() throws Exception {
        Path root = new StorageResolver(appDir).ensureInstallRoot(ContentScope.CLIENT);

        assertTrue(Files.isDirectory(root));
    }

    @Test
    void resolve_shouldAnchorRelativePaths() {
        StorageResolver storage = new StorageResolver(appDir);
        Path absolute = appDir.resolveSibling("elsewhere.pem").toAbsolutePath();

        assertEquals(appDir.resolve("keys/public.pem"), storage.resolve("keys/public.pem"));
        assertEquals(absolute, storage.resolve(absolute.toString()));
    }
}
