package de.bsommerfeld.gamesync.updater.api;

import de.bsommerfeld.gamesync.updater.diff.DiffEngine;
import de.bsommerfeld.gamesync.updater.download.DownloadOrchestrator;
import de.bsommerfeld.gamesync.updater.download.DownloadSession;
import de.bsommerfeld.gamesync.updater.download.FileUrlResolver;
import de.bsommerfeld.gamesync.updater.hash.DirectoryHasher;
import de.bsommerfeld.gamesync.updater.hash.HashedTree;
import de.bsommerfeld.gamesync.updater.manifest.ManifestFormatException;
import de.bsommerfeld.gamesync.updater.manifest.ManifestVerifier;
import de.bsommerfeld.gamesync.updater.model.ContentScope;
import de.bsommerfeld.gamesync.updater.model.DirEntry;
import de.bsommerfeld.gamesync.updater.model.Manifest;
import de.bsommerfeld.gamesync.updater.model.PathEscapeException;
import de.bsommerfeld.gamesync.updater.model.SessionSummary;
import de.bsommerfeld.gamesync.updater.model.SyncPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Client side of the update pipeline: verify the manifest, hash the local
 * tree, diff, and download.
 *
 * <pre>{@code
 * SyncResult result = client.sync(wireJson, ContentScope.CLIENT, installDir,
 *         FileUrlResolver.under(filesBase), token);
 * }</pre>
 *
 * <p>
 * Nothing is read from or written to the sandbox before the manifest
 * signature has been checked. Running the same sync twice is safe: the
 * second run finds every file matching and plans nothing.
 */
public final class SyncClient {

    private static final Logger LOG = LoggerFactory.getLogger(SyncClient.class);

    private final ManifestVerifier verifier;
    private final DirectoryHasher hasher;
    private final DiffEngine diffEngine;
    private final DownloadOrchestrator orchestrator;

    public SyncClient(ManifestVerifier verifier, DirectoryHasher hasher, DiffEngine diffEngine,
            DownloadOrchestrator orchestrator) {
        this.verifier = verifier;
        this.hasher = hasher;
        this.diffEngine = diffEngine;
        this.orchestrator = orchestrator;
    }

    /**
     * Verifies the manifest and computes what a sync would do, without
     * changing anything.
     *
     * @param expectedScope the scope the sandbox holds, or {@code null} to accept any
     * @throws SyncException if the signature is invalid, the signed content is
     *                       malformed or of the wrong scope, or the sandbox
     *                       cannot be read
     */
    public Prepared plan(String wireJson, ContentScope expectedScope, Path sandboxRoot) throws SyncException {
        Manifest manifest = trusted(wireJson, expectedScope);
        HashedTree local = hasher.hash(sandboxRoot);
        if (!local.isComplete())
            LOG.warn("{} local entries could not be hashed and will be treated as missing", local.failures().size());
        SyncPlan plan = diffEngine.diff(local.root(), manifest);
        return new Prepared(manifest, local, plan);
    }

    /**
     * Verifies the manifest and plans a first install into an empty
     * directory that does not exist yet.
     *
     * @throws SyncException if the signature is invalid, or the signed content
     *                       is malformed or of the wrong scope
     */
    public Prepared planFreshInstall(String wireJson, ContentScope expectedScope) throws SyncException {
        Manifest manifest = trusted(wireJson, expectedScope);
        HashedTree nothing = new HashedTree(DirEntry.emptyRoot(), List.of());
        return new Prepared(manifest, nothing, diffEngine.diff(nothing.root(), manifest));
    }

    /**
     * Starts the download session for a prepared plan and returns at once.
     */
    public DownloadSession start(Prepared prepared, Path sandboxRoot, FileUrlResolver urls, String authToken) {
        return orchestrator.start(sandboxRoot, prepared.plan(), urls, authToken);
    }

    /**
     * Runs the whole pipeline and blocks until the session ends.
     *
     * @throws SyncException        see {@link #plan}
     * @throws InterruptedException if interrupted while waiting; the session is cancelled
     */
    public SyncResult sync(String wireJson, ContentScope expectedScope, Path sandboxRoot, FileUrlResolver urls,
            String authToken) throws SyncException, InterruptedException {
        Prepared prepared = plan(wireJson, expectedScope, sandboxRoot);
        DownloadSession session = start(prepared, sandboxRoot, urls, authToken);

        SessionSummary summary;
        try {
            summary = session.await();
        } catch (InterruptedException e) {
            session.cancel();
            throw e;
        }

        return new SyncResult(prepared.manifest(), prepared.plan(), session.sessionId(), session.state(), summary,
                session.failedFiles(), prepared.local().failures());
    }

    /** {@link #sync(String, ContentScope, Path, FileUrlResolver, String)} accepting any content scope. */
    public SyncResult sync(String wireJson, Path sandboxRoot, FileUrlResolver urls, String authToken)
            throws SyncException, InterruptedException {
        return sync(wireJson, null, sandboxRoot, urls, authToken);
    }

    private Manifest trusted(String wireJson, ContentScope expectedScope) throws SyncException {
        Manifest manifest;
        try {
            manifest = verifier.verify(wireJson);
        } catch (PathEscapeException | ManifestFormatException e) {
            LOG.warn("Signed manifest rejected: {}", e.getMessage());
            throw new SyncException("Signed manifest is malformed: " + e.getMessage(), e);
        }
        if (expectedScope != null && manifest.contentScope() != expectedScope)
            throw new SyncException("Manifest describes '" + manifest.contentScope().wireName()
                    + "' content, expected '" + expectedScope.wireName() + "'");
        return manifest;
    }

    /** A verified manifest with the local snapshot and plan computed from it. */
    public record Prepared(Manifest manifest, HashedTree local, SyncPlan plan) {
    }
}
