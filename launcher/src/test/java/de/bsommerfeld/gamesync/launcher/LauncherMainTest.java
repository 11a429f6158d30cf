package de.bsommerfeld.gamesync.launcher;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the command line end to end against a temporary data directory,
 * with {@code file:} URIs standing in for the update server.
 */
class LauncherMainTest {

    @TempDir
    Path appDir;

    @TempDir
    Path content;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private int run(String... args) {
        StorageResolver storage = new StorageResolver(appDir);
        return new LauncherMain(storage, new PrintStream(buffer, true, StandardCharsets.UTF_8)).run(args);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    // -- usage --

    @Test
    void run_shouldPrintUsageWithoutArguments() {
        assertEquals(LauncherMain.EXIT_USAGE, run());
        assertTrue(output().contains("Usage:"));
    }

    @Test
    void run_shouldRejectUnknownCommand() {
        assertEquals(LauncherMain.EXIT_USAGE, run("frobnicate"));
        assertTrue(output().contains("Unknown command: frobnicate"));
    }

    @Test
    void run_shouldRejectUnknownScope() {
        assertEquals(LauncherMain.EXIT_USAGE, run("publish", content.toString(), "mods", "out.json"));
        assertTrue(output().contains("Unknown content scope: mods"));
    }

    @Test
    void run_shouldRejectWrongArgumentCount() {
        assertEquals(LauncherMain.EXIT_USAGE, run("sync", "only-one"));
    }

    // -- commands --

    @Test
    void keygen_shouldCreateKeyPairAndConfig() {
        assertEquals(LauncherMain.EXIT_OK, run("keygen"));

        assertTrue(Files.exists(appDir.resolve("keys/private.pem")));
        assertTrue(Files.exists(appDir.resolve("keys/public.pem")));
        assertTrue(Files.exists(appDir.resolve("config.toml")));
    }

    @Test
    void publishAndSync_shouldInstallContent() throws Exception {
        Files.writeString(content.resolve("client.jar"), "client bytes");
        Files.createDirectories(content.resolve("libraries"));
        Files.writeString(content.resolve("libraries/dep.jar"), "dependency");
        Path manifest = appDir.resolve("published/client.json");

        assertEquals(LauncherMain.EXIT_OK, run("publish", content.toString(), "client", manifest.toString()));
        assertEquals(LauncherMain.EXIT_OK, run("sync", manifest.toString(), content.toUri().toString(), "client"));

        Path installed = appDir.resolve("instances/client");
        assertEquals("client bytes", Files.readString(installed.resolve("client.jar")));
        assertEquals("dependency", Files.readString(installed.resolve("libraries/dep.jar")));
        assertTrue(output().contains("Sync finished"));

        assertEquals(LauncherMain.EXIT_OK, run("plan", manifest.toString(), "client"));
        assertTrue(output().contains("Up to date"));
    }

    @Test
    void plan_shouldReportMissingInstallWithoutCreatingIt() throws Exception {
        Files.writeString(content.resolve("client.jar"), "client bytes");
        Path manifest = appDir.resolve("published/client.json");
        assertEquals(LauncherMain.EXIT_OK, run("publish", content.toString(), "client", manifest.toString()));

        assertEquals(LauncherMain.EXIT_OK, run("plan", manifest.toString(), "client"));

        assertTrue(output().contains("Not installed yet"));
        assertTrue(output().contains("fetch  client.jar"));
        assertFalse(Files.exists(appDir.resolve("instances/client")));
    }

    @Test
    void sync_shouldFailWithoutTrustedKey() throws Exception {
        Path manifest = Files.writeString(appDir.resolve("manifest.json"), "{}");

        assertEquals(LauncherMain.EXIT_ERROR, run("sync", manifest.toString(), content.toString(), "client"));
        assertFalse(Files.exists(appDir.resolve("instances/client/client.jar")));
    }

    @Test
    void sync_shouldRejectManifestOfOtherScope() throws Exception {
        Files.writeString(content.resolve("runtime.bin"), "jre");
        Path manifest = appDir.resolve("jvm.json");
        assertEquals(LauncherMain.EXIT_OK, run("publish", content.toString(), "jvm", manifest.toString()));

        assertEquals(LauncherMain.EXIT_ERROR, run("sync", manifest.toString(), content.toString(), "client"));
        assertTrue(output().contains("expected 'client'"));
    }

    @Test
    void launch_shouldFailWithoutSynchronizedClient() throws Exception {
        Files.createDirectories(appDir.resolve("instances/client"));

        assertEquals(LauncherMain.EXIT_ERROR, run("launch", "client", "net.game.Main"));
        assertTrue(output().contains("No jars"));
    }

    // -- helpers --

    @Test
    void toUri_shouldKeepAbsoluteUris() {
        assertEquals(URI.create("https://cdn.example.com/client.json"),
                LauncherMain.toUri("https://cdn.example.com/client.json"));
    }

    @Test
    void toUri_shouldConvertPlainPaths() {
        URI uri = LauncherMain.toUri("relative/manifest.json");

        assertEquals("file", uri.getScheme());
        assertEquals(Path.of("relative/manifest.json").toAbsolutePath(), Path.of(uri));
    }
}
