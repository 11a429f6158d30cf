package de.bsommerfeld.gamesync.updater.download;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.bsommerfeld.gamesync.updater.api.SandboxUnavailableException;
import de.bsommerfeld.gamesync.updater.hash.HashUtil;
import de.bsommerfeld.gamesync.updater.hash.VerificationPolicy;
import de.bsommerfeld.gamesync.updater.model.FileEntry;
import de.bsommerfeld.gamesync.updater.model.PathEscapeException;
import de.bsommerfeld.gamesync.updater.model.SyncPlan;
import de.bsommerfeld.gamesync.updater.progress.ProgressChannel;
import de.bsommerfeld.gamesync.updater.progress.SyncEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

/**
 * Executes {@link SyncPlan}s against a sandbox directory.
 *
 * <h3>Per file</h3>
 * The destination is resolved through the session's {@link Sandbox}; a path
 * that leaves it fails that file only. Bytes stream into
 * {@code <name>.<sessionId>.part} next to the destination and are moved into
 * place only after their size and digest match the manifest, so a broken
 * transfer never replaces a good file. A digest mismatch is retried up to
 * {@link OrchestratorSettings#maxAttempts()}; I/O errors fail the file at
 * once. The manifest size is passed to the fetcher as a hard limit, so an
 * oversized response stops at the first chunk past it. Verify entries are re-hashed and fetched again if they differ.
 *
 * <h3>Deletions</h3>
 * Run after every fetch and verify succeeded. If any file failed they are
 * all deferred to the next sync. A deletion that fails (file locked by the
 * running game) is deferred as well. Directories left empty are removed, the
 * sandbox root never.
 *
 * <h3>Concurrency</h3>
 * Transfers run on a bounded worker pool shared by all sessions; each
 * session is driven by its own coordinator thread. The only cross-session
 * state is the id lookup used by {@link #cancel(String)}, and a session
 * leaves it when it ends.
 *
 * <h3>Cancellation</h3>
 * Cooperative: transfers stop at their next chunk boundary, delete their
 * temporary file, and untouched files are counted as cancelled. Completed
 * files stay. The session ends in {@link SessionState#CANCELLED} and no
 * deletions run.
 */
public final class DownloadOrchestrator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DownloadOrchestrator.class);

    static final String PART_SUFFIX = ".part";

    private final FileFetcher fetcher;
    private final ProgressChannel channel;
    private final OrchestratorSettings settings;
    private final VerificationPolicy policy;
    private final ExecutorService workers;
    private final ExecutorService coordinators;
    private final Map<String, DownloadSession> sessions = new ConcurrentHashMap<>();

    public DownloadOrchestrator(FileFetcher fetcher, ProgressChannel channel, OrchestratorSettings settings,
            VerificationPolicy policy) {
        this.fetcher = fetcher;
        this.channel = channel;
        this.settings = settings;
        this.policy = policy;
        this.workers = Executors.newFixedThreadPool(settings.workers(),
                new ThreadFactoryBuilder().setNameFormat("gamesync-download-%d").setDaemon(true).build());
        this.coordinators = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder().setNameFormat("gamesync-session-%d").setDaemon(true).build());
    }

    /**
     * Starts executing the plan in the background and returns immediately.
     *
     * @param sandboxRoot absolute directory all writes are confined to
     * @param urls        source location for every file in the plan
     * @param authToken   bearer token passed to the fetcher, may be {@code null}
     */
    public DownloadSession start(Path sandboxRoot, SyncPlan plan, FileUrlResolver urls, String authToken) {
        String sessionId = UUID.randomUUID().toString();
        DownloadSession session = new DownloadSession(sessionId, plan, new Sandbox(sandboxRoot.toAbsolutePath()));
        sessions.put(sessionId, session);
        LOG.info("Session {} started: {} to fetch, {} to verify, {} to delete in {}", sessionId,
                plan.toFetch().size(), plan.toVerify().size(), plan.toDelete().size(), session.sandbox().root());
        coordinators.execute(() -> run(session, urls, authToken));
        return session;
    }

    /** @return {@code false} if no running session has this id */
    public boolean cancel(String sessionId) {
        DownloadSession session = sessions.get(sessionId);
        if (session == null)
            return false;
        LOG.info("Cancelling session {}", sessionId);
        session.cancel();
        return true;
    }

    /** A session that has not ended yet. */
    public Optional<DownloadSession> session(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void close() {
        sessions.values().forEach(DownloadSession::cancel);
        coordinators.shutdown();
        workers.shutdown();
    }

    // =====================================================================
    // Session lifecycle
    // =====================================================================

    private void run(DownloadSession session, FileUrlResolver urls, String authToken) {
        String id = session.sessionId();
        try {
            session.transition(SessionState.RUNNING);
            session.sandbox().requireAccessible();

            SyncPlan plan = session.plan();
            int total = plan.toFetch().size() + plan.toVerify().size();
            channel.publish(new SyncEvent.Queued(id, total, plan.bytesToFetch()));

            List<CompletableFuture<Void>> tasks = new ArrayList<>();
            for (FileEntry entry : plan.toFetch()) {
                tasks.add(CompletableFuture.runAsync(
                        () -> processEntry(session, entry, false, urls, authToken, total), workers));
            }
            for (FileEntry entry : plan.toVerify()) {
                tasks.add(CompletableFuture.runAsync(
                        () -> processEntry(session, entry, true, urls, authToken, total), workers));
            }
            CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).join();

            if (session.isCancelled()) {
                end(session, SessionState.CANCELLED,
                        new SyncEvent.SessionCancelled(id, session.summary()));
                return;
            }

            runDeletes(session);

            if (session.isCancelled()) {
                end(session, SessionState.CANCELLED,
                        new SyncEvent.SessionCancelled(id, session.summary()));
            } else {
                end(session, SessionState.COMPLETED,
                        new SyncEvent.SessionComplete(id, session.summary()));
            }
        } catch (SandboxUnavailableException e) {
            LOG.error("Session {} failed: {}", id, e.getMessage());
            failSession(session, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Session {} failed unexpectedly", id, e);
            failSession(session, e.toString());
        }
    }

    private void failSession(DownloadSession session, String reason) {
        session.fail(reason);
        end(session, SessionState.FAILED, new SyncEvent.SessionFailed(session.sessionId(), reason));
    }

    private void end(DownloadSession session, SessionState state, SyncEvent event) {
        session.transition(state);
        sessions.remove(session.sessionId());
        LOG.info("Session {} {}: {}", session.sessionId(), state, session.summary());
        channel.publish(event);
        session.finish();
    }

    // =====================================================================
    // Fetch and verify
    // =====================================================================

    private void processEntry(DownloadSession session, FileEntry entry, boolean verifyFirst, FileUrlResolver urls,
            String authToken, int total) {
        String id = session.sessionId();
        String path = entry.relativePath();
        try {
            session.control().checkpoint();
            Path target = session.sandbox().resolve(path);
            session.sandbox().requireNoLinks(target);

            if (verifyFirst && localCopyMatches(entry, target)) {
                int done = session.markCompleted(path, 0);
                channel.publish(new SyncEvent.FileVerified(id, path, done, total));
                return;
            }

            URI url = urls.resolve(entry);
            DownloadSession.Transfer transfer = session.claim(new DownloadKey(url, target));
            if (!transfer.owner()) {
                // the owning task reports the outcome for this path
                transfer.future().exceptionally(e -> -1L).join();
                return;
            }

            long bytes;
            try {
                bytes = fetchVerified(session, entry, target, url, authToken);
                transfer.future().complete(bytes);
            } catch (IOException | RuntimeException e) {
                transfer.future().completeExceptionally(e);
                throw e;
            }

            int done = session.markCompleted(path, bytes);
            channel.publish(new SyncEvent.FileVerified(id, path, done, total));
        } catch (CancellationException e) {
            session.markCancelled();
        } catch (PathEscapeException e) {
            LOG.warn("SECURITY: blocked write outside sandbox {} in session {}: {}",
                    session.sandbox().root(), id, e.getMessage());
            failFile(session, path, "Path escapes sandbox: " + e.getMessage());
        } catch (IOException e) {
            LOG.warn("Download of {} failed: {}", path, e.getMessage());
            failFile(session, path, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected error processing {}", path, e);
            failFile(session, path, e.toString());
        }
    }

    private void failFile(DownloadSession session, String path, String reason) {
        session.markFailed(path, reason);
        channel.publish(new SyncEvent.FileFailed(session.sessionId(), path, reason));
    }

    private boolean localCopyMatches(FileEntry entry, Path target) {
        if (!Files.isRegularFile(target, LinkOption.NOFOLLOW_LINKS))
            return false;
        try {
            long size = Files.size(target);
            if (size == entry.size() && HashUtil.matches(entry.contentHash(), digest(entry.relativePath(), target, size)))
                return true;
            LOG.info("Local copy of {} does not match the manifest, fetching again", entry.relativePath());
        } catch (IOException e) {
            LOG.info("Cannot re-hash {}, fetching again: {}", entry.relativePath(), e.getMessage());
        }
        return false;
    }

    /**
     * Downloads into the temporary file, checks it and moves it into place.
     *
     * @return bytes written to the destination
     */
    private long fetchVerified(DownloadSession session, FileEntry entry, Path target, URI url, String authToken)
            throws IOException {
        String id = session.sessionId();
        String path = entry.relativePath();
        Path temp = target.resolveSibling(target.getFileName() + "." + id + PART_SUFFIX);
        channel.publish(new SyncEvent.DownloadStarted(id, path, entry.size()));

        for (int attempt = 1; ; attempt++) {
            try {
                prepareParent(session.sandbox(), target);
                String mismatch;
                try {
                    long written = fetcher.fetch(new FetchRequest(url, temp, authToken, session.control(), entry.size()),
                            (read, totalBytes) -> channel.publish(new SyncEvent.Progress(id, path, read, entry.size())));
                    mismatch = mismatch(entry, temp, written);
                    if (mismatch == null) {
                        session.control().checkpoint();
                        moveIntoPlace(temp, target);
                        return written;
                    }
                } catch (HashMismatchException e) {
                    mismatch = e.getMessage();
                }

                Files.deleteIfExists(temp);
                if (attempt >= settings.maxAttempts())
                    throw new HashMismatchException(mismatch + " after " + attempt + " attempt(s)");
                LOG.warn("{}: {}, retrying ({}/{})", path, mismatch, attempt, settings.maxAttempts());
            } catch (IOException | RuntimeException e) {
                deletePartial(temp);
                throw e;
            }
        }
    }

    private String mismatch(FileEntry entry, Path temp, long written) throws IOException {
        if (written != entry.size())
            return "Size mismatch (expected " + entry.size() + ", got " + written + ")";
        if (!HashUtil.matches(entry.contentHash(), digest(entry.relativePath(), temp, written)))
            return "Hash mismatch";
        return null;
    }

    private String digest(String relativePath, Path file, long size) throws IOException {
        String placeholder = policy.placeholderFor(relativePath, size);
        return placeholder != null ? placeholder : HashUtil.sha256(file);
    }

    /**
     * Creates the destination's parent directories. A regular file standing
     * where the manifest needs a directory is removed first.
     */
    private static void prepareParent(Sandbox sandbox, Path target) throws IOException {
        Path parent = target.getParent();
        Path current = sandbox.root();
        for (Path segment : sandbox.root().relativize(parent)) {
            current = current.resolve(segment);
            if (Files.isRegularFile(current, LinkOption.NOFOLLOW_LINKS)) {
                LOG.info("Replacing file {} with a directory", sandbox.root().relativize(current));
                Files.deleteIfExists(current);
            }
        }
        Files.createDirectories(parent);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        if (Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
            LOG.info("Replacing directory {} with a file", target);
            MoreFiles.deleteRecursively(target, RecursiveDeleteOption.ALLOW_INSECURE);
        }
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deletePartial(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warn("Could not remove partial download {}: {}", temp, e.getMessage());
        }
    }

    // =====================================================================
    // Deletions
    // =====================================================================

    private void runDeletes(DownloadSession session) {
        List<String> toDelete = session.plan().toDelete();
        if (toDelete.isEmpty())
            return;

        if (session.hasFailures()) {
            LOG.info("Deferring {} deletions in session {}: {} files failed", toDelete.size(),
                    session.sessionId(), session.failedFiles().size());
            toDelete.forEach(session::deferDelete);
            return;
        }

        Sandbox sandbox = session.sandbox();
        for (String path : toDelete) {
            if (session.isCancelled()) {
                session.deferDelete(path);
                continue;
            }
            try {
                Path target = sandbox.resolve(path);
                sandbox.requireNoLinks(target);
                // gone already, or replaced by a directory from the manifest
                if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS) || Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS))
                    continue;

                Files.delete(target);
                session.markDeleted();
                channel.publish(new SyncEvent.FileDeleted(session.sessionId(), path));
                pruneEmptyParents(sandbox.root(), target);
            } catch (PathEscapeException e) {
                LOG.warn("SECURITY: refused to delete outside sandbox {}: {}", sandbox.root(), e.getMessage());
            } catch (IOException e) {
                LOG.warn("Could not delete {}, retrying on next sync: {}", path, e.getMessage());
                session.deferDelete(path);
            }
        }
    }

    /** Walks up and removes empty directories, but never the sandbox root. */
    private static void pruneEmptyParents(Path root, Path file) {
        Path parent = file.getParent();
        try {
            while (parent != null && !parent.equals(root) && parent.startsWith(root) && isEmptyDirectory(parent)) {
                Files.delete(parent);
                parent = parent.getParent();
            }
        } catch (IOException e) {
            LOG.debug("Stopped pruning at {}: {}", parent, e.getMessage());
        }
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }
}
