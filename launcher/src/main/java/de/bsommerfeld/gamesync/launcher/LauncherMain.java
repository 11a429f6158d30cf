package de.bsommerfeld.gamesync.launcher;

import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import de.bsommerfeld.gamesync.core.config.SyncConfig;
import de.bsommerfeld.gamesync.core.event.ApplicationEventBus;
import de.bsommerfeld.gamesync.updater.api.SyncClient;
import de.bsommerfeld.gamesync.updater.api.SyncException;
import de.bsommerfeld.gamesync.updater.api.SyncResult;
import de.bsommerfeld.gamesync.updater.download.DownloadOrchestrator;
import de.bsommerfeld.gamesync.updater.download.FileFetcher;
import de.bsommerfeld.gamesync.updater.download.FileUrlResolver;
import de.bsommerfeld.gamesync.updater.manifest.ManifestPublisher;
import de.bsommerfeld.gamesync.updater.model.ContentScope;
import de.bsommerfeld.gamesync.updater.model.SyncPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Command line entry point.
 *
 * <pre>
 * keygen                                              create the signing key pair if absent
 * publish &lt;dir&gt; &lt;scope&gt; &lt;out.json&gt;                  sign a manifest for a content directory
 * plan &lt;manifest-uri&gt; &lt;scope&gt;                         show what a sync would change
 * sync &lt;manifest-uri&gt; &lt;files-base-uri&gt; &lt;scope&gt; [token] bring the scope's install directory up to date
 * launch &lt;scope&gt; &lt;main-class&gt; [args...]               start the game from a synchronized directory
 * </pre>
 *
 * Scopes are {@code client}, {@code asset} and {@code jvm}. URIs may be
 * {@code http(s):}, {@code file:} or plain paths.
 *
 * <h3>Exit codes</h3>
 * {@code 0} success, {@code 1} error, {@code 2} usage, {@code 3} sync ended
 * with failed or cancelled files.
 */
public final class LauncherMain {

    static {
        // Must run before the first logger is created so logback.xml can see it
        Path logDir = StorageResolver.platformDefault().logsDir();
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (IOException e) {
            System.err.println("Failed to create log directory: " + logDir);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(LauncherMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INCOMPLETE = 3;

    private static final Duration GAME_TIMEOUT = Duration.ofHours(24);

    private final StorageResolver storage;
    private final PrintStream out;
    private Injector injector;

    LauncherMain(StorageResolver storage, PrintStream out) {
        this.storage = storage;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new LauncherMain(StorageResolver.platformDefault(), System.out).run(args));
    }

    int run(String... args) {
        if (args.length == 0) {
            printUsage();
            return EXIT_USAGE;
        }

        String command = args[0];
        List<String> params = Arrays.asList(args).subList(1, args.length);
        LOG.info("Launcher command '{}' in {}", command, storage.appDir());

        try {
            switch (command) {
                case "keygen":
                    return keygen();
                case "publish":
                    return params.size() == 3 ? publish(params) : usage();
                case "plan":
                    return params.size() == 2 ? plan(params) : usage();
                case "sync":
                    return params.size() == 3 || params.size() == 4 ? sync(params) : usage();
                case "launch":
                    return params.size() >= 2 ? launch(params) : usage();
                default:
                    out.println("Unknown command: " + command);
                    return usage();
            }
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            return usage();
        } catch (SyncException e) {
            LOG.error("{} failed: {}", command, e.getMessage());
            out.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException | ProvisionException | CreationException e) {
            LOG.error("{} failed", command, e);
            out.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            out.println("Interrupted");
            return EXIT_ERROR;
        }
    }

    // =====================================================================
    // Commands
    // =====================================================================

    private int keygen() {
        KeyPair keys = injector().getInstance(KeyPair.class);
        Path publicKey = storage.resolve(injector().getInstance(SyncConfig.class).getKeys().getPublicKey());
        out.println("Signing keys ready (" + keys.getPublic().getAlgorithm() + "), public key: " + publicKey);
        return EXIT_OK;
    }

    private int publish(List<String> params) throws SyncException, IOException {
        Path contentDir = Path.of(params.get(0)).toAbsolutePath();
        ContentScope scope = ContentScope.fromWireName(params.get(1));
        Path target = Path.of(params.get(2)).toAbsolutePath();

        String wire = injector().getInstance(ManifestPublisher.class).publishWireJson(contentDir, scope);
        if (target.getParent() != null)
            Files.createDirectories(target.getParent());
        Files.writeString(target, wire, StandardCharsets.UTF_8);
        out.println("Published " + scope.wireName() + " manifest for " + contentDir + " to " + target);
        return EXIT_OK;
    }

    private int plan(List<String> params) throws SyncException, IOException {
        Injector injector = injector();
        ContentScope scope = ContentScope.fromWireName(params.get(1));
        String wire = injector.getInstance(FileFetcher.class).fetchText(toUri(params.get(0)), null);

        SyncClient client = injector.getInstance(SyncClient.class);
        Path root = storage.installRoot(scope);
        SyncPlan plan;
        if (Files.isDirectory(root)) {
            plan = client.plan(wire, scope, root).plan();
        } else {
            out.println("Not installed yet: " + root);
            plan = client.planFreshInstall(wire, scope).plan();
        }
        plan.toFetch().forEach(f -> out.println("fetch  " + f.relativePath()));
        plan.toVerify().forEach(f -> out.println("verify " + f.relativePath()));
        plan.toDelete().forEach(p -> out.println("delete " + p));
        out.println(plan.isEmpty() ? "Up to date" : plan.totalChanges() + " change(s) pending");
        return EXIT_OK;
    }

    private int sync(List<String> params) throws SyncException, IOException, InterruptedException {
        Injector injector = injector();
        URI manifestUri = toUri(params.get(0));
        FileUrlResolver urls = FileUrlResolver.under(toUri(params.get(1)));
        ContentScope scope = ContentScope.fromWireName(params.get(2));
        String token = params.size() > 3 ? params.get(3) : null;

        String wire = injector.getInstance(FileFetcher.class).fetchText(manifestUri, token);
        Path root = storage.ensureInstallRoot(scope);

        ApplicationEventBus eventBus = injector.getInstance(ApplicationEventBus.class);
        SyncReporter reporter = new SyncReporter(out);
        eventBus.register(reporter);
        try (DownloadOrchestrator orchestrator = injector.getInstance(DownloadOrchestrator.class)) {
            SyncResult result = injector.getInstance(SyncClient.class).sync(wire, scope, root, urls, token);
            if (!reporter.awaitSessionEnd(5, TimeUnit.SECONDS))
                LOG.warn("Session {} ended without a final progress event", result.sessionId());
            if (result.isUpToDate())
                return EXIT_OK;
            result.failedFiles().forEach((path, reason) -> out.println("  " + path + ": " + reason));
            return EXIT_INCOMPLETE;
        } finally {
            eventBus.unregister(reporter);
        }
    }

    private int launch(List<String> params) throws IOException, InterruptedException {
        ContentScope scope = ContentScope.fromWireName(params.get(0));
        LaunchSpec spec = LaunchSpec.forInstall(storage.installRoot(scope), storage.installRoot(ContentScope.RUNTIME),
                List.of(), params.get(1), params.subList(2, params.size()));

        ProcessResult result = new GameProcess(GAME_TIMEOUT).run(spec,
                (error, line) -> (error ? System.err : out).println(line));
        return result.exitCode();
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private Injector injector() {
        if (injector == null)
            injector = Guice.createInjector(new AppModule(storage));
        return injector;
    }

    /** Accepts absolute URIs and plain file system paths. */
    static URI toUri(String value) {
        // a single letter before ':' is a Windows drive, not a scheme
        int colon = value.indexOf(':');
        if (colon > 1) {
            URI uri = URI.create(value);
            if (uri.isAbsolute())
                return uri;
        }
        return Path.of(value).toAbsolutePath().toUri();
    }

    private int usage() {
        printUsage();
        return EXIT_USAGE;
    }

    private void printUsage() {
        out.println("Usage:");
        out.println("  keygen");
        out.println("  publish <dir> <scope> <out.json>");
        out.println("  plan <manifest-uri> <scope>");
        out.println("  sync <manifest-uri> <files-base-uri> <scope> [token]");
        out.println("  launch <scope> <main-class> [args...]");
        out.println("Scopes: client, asset, jvm");
    }
}
