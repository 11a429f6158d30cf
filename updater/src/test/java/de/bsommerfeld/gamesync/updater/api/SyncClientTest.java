package de.bsommerfeld.gamesync.updater.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.util.concurrent.MoreExecutors;
import de.bsommerfeld.gamesync.updater.diff.DiffEngine;
import de.bsommerfeld.gamesync.updater.diff.DiffRules;
import de.bsommerfeld.gamesync.updater.download.DownloadOrchestrator;
import de.bsommerfeld.gamesync.updater.download.FileUrlResolver;
import de.bsommerfeld.gamesync.updater.download.LocalFileFetcher;
import de.bsommerfeld.gamesync.updater.download.OrchestratorSettings;
import de.bsommerfeld.gamesync.updater.download.SessionState;
import de.bsommerfeld.gamesync.updater.hash.DirectoryHasher;
import de.bsommerfeld.gamesync.updater.hash.HashOptions;
import de.bsommerfeld.gamesync.updater.hash.VerificationPolicy;
import de.bsommerfeld.gamesync.updater.manifest.ManifestCodec;
import de.bsommerfeld.gamesync.updater.manifest.ManifestKeys;
import de.bsommerfeld.gamesync.updater.manifest.ManifestPublisher;
import de.bsommerfeld.gamesync.updater.manifest.ManifestSigner;
import de.bsommerfeld.gamesync.updater.manifest.ManifestVerifier;
import de.bsommerfeld.gamesync.updater.manifest.SignatureInvalidException;
import de.bsommerfeld.gamesync.updater.model.ContentScope;
import de.bsommerfeld.gamesync.updater.progress.ProgressChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static de.bsommerfeld.gamesync.updater.TestTrees.write;
import static org.junit.jupiter.api.Assertions.*;

class SyncClientTest {

    private static KeyPair keys;

    @TempDir
    Path published;

    @TempDir
    Path install;

    private final ManifestCodec codec = new ManifestCodec();
    private final DirectoryHasher hasher = new DirectoryHasher(HashOptions.defaults());
    private DownloadOrchestrator orchestrator;
    private SyncClient client;
    private FileUrlResolver urls;

    @BeforeAll
    static void generateKeys() {
        keys = ManifestKeys.generate();
    }

    @BeforeEach
    void setUp() {
        orchestrator = new DownloadOrchestrator(new LocalFileFetcher(),
                new ProgressChannel(MoreExecutors.directExecutor(), 64), OrchestratorSettings.defaults(),
                VerificationPolicy.fullHash());
        client = new SyncClient(new ManifestVerifier(keys.getPublic(), codec), hasher,
                new DiffEngine(DiffRules.none()), orchestrator);
        urls = FileUrlResolver.under(published.toUri());
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
    }

    @Test
    void sync_shouldMirrorPublishedDirectory() throws Exception {
        write(published, "game.jar", "game");
        write(published, "libraries/dep one.jar", "dependency");
        write(install, "crash-report.txt", "left over");

        SyncResult result = client.sync(publish(ContentScope.CLIENT), ContentScope.CLIENT, install, urls, "token");

        assertTrue(result.isUpToDate());
        assertEquals(SessionState.COMPLETED, result.state());
        assertEquals("game", Files.readString(install.resolve("game.jar")));
        assertEquals("dependency", Files.readString(install.resolve("libraries/dep one.jar")));
        assertFalse(Files.exists(install.resolve("crash-report.txt")));
        assertEquals(2, result.summary().completed());
        assertEquals(1, result.summary().deleted());
    }

    @Test
    void sync_shouldBeIdempotent() throws Exception {
        write(published, "game.jar", "game");
        write(published, "assets/a/b.png", "png");
        String wire = publish(ContentScope.ASSET_INDEX);

        client.sync(wire, install, urls, null);
        SyncResult second = client.sync(wire, install, urls, null);

        assertTrue(second.plan().isEmpty());
        assertEquals(0, second.summary().completed());
        assertTrue(second.isUpToDate());
    }

    @Test
    void plan_shouldNotTouchSandbox() throws Exception {
        write(published, "game.jar", "game");

        SyncClient.Prepared prepared = client.plan(publish(ContentScope.CLIENT), null, install);

        assertEquals(1, prepared.plan().toFetch().size());
        assertEquals(List.of(), listInstall());
    }

    @Test
    void planFreshInstall_shouldFetchEverythingWithoutReadingDisk() throws Exception {
        write(published, "game.jar", "game");
        write(published, "libs/dep.jar", "dep");
        Path nowhere = install.resolve("not-created");

        SyncClient.Prepared prepared = client.planFreshInstall(publish(ContentScope.CLIENT), ContentScope.CLIENT);

        assertEquals(2, prepared.plan().toFetch().size());
        assertTrue(prepared.plan().toDelete().isEmpty());
        assertTrue(prepared.local().isComplete());
        assertFalse(Files.exists(nowhere));
    }

    @Test
    void planFreshInstall_shouldCheckScope() throws Exception {
        write(published, "game.jar", "game");

        assertThrows(SyncException.class, () -> client.planFreshInstall(publish(ContentScope.CLIENT), ContentScope.RUNTIME));
    }

    @Test
    void sync_shouldRejectTamperedManifestBeforeTouchingDisk() throws Exception {
        write(published, "game.jar", "game");
        write(install, "keep.txt", "mine");
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode wire = (ObjectNode) mapper.readTree(publish(ContentScope.CLIENT));
        ((ObjectNode) wire.get("manifest")).put("contentScope", "jvm");

        assertThrows(SignatureInvalidException.class,
                () -> client.sync(mapper.writeValueAsString(wire), install, urls, null));
        assertEquals(List.of("keep.txt"), listInstall());
    }

    @Test
    void sync_shouldRejectManifestSignedWithOtherKey() throws Exception {
        write(published, "game.jar", "game");
        KeyPair other = ManifestKeys.generate();
        String wire = new ManifestPublisher(hasher, new ManifestSigner(other.getPrivate(), codec), codec,
                Clock.systemUTC()).publishWireJson(published, ContentScope.CLIENT);

        assertThrows(SignatureInvalidException.class, () -> client.sync(wire, install, urls, null));
        assertEquals(List.of(), listInstall());
    }

    @Test
    void sync_shouldRejectManifestForOtherScope() throws Exception {
        write(published, "java", "runtime");

        SyncException e = assertThrows(SyncException.class,
                () -> client.sync(publish(ContentScope.RUNTIME), ContentScope.CLIENT, install, urls, null));
        assertTrue(e.getMessage().contains("jvm"));
        assertEquals(List.of(), listInstall());
    }

    @Test
    void sync_shouldFailForMissingInstallDirectory() throws Exception {
        write(published, "game.jar", "game");

        assertThrows(SandboxUnavailableException.class,
                () -> client.sync(publish(ContentScope.CLIENT), install.resolve("missing"), urls, null));
    }

    private String publish(ContentScope scope) throws SyncException {
        return new ManifestPublisher(hasher, new ManifestSigner(keys.getPrivate(), codec), codec, Clock.systemUTC())
                .publishWireJson(published, scope);
    }

    private List<String> listInstall() throws Exception {
        try (Stream<Path> files = Files.list(install)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }
}
