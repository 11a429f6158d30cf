package de.bsommerfeld.gamesync.updater.download;

import de.bsommerfeld.gamesync.updater.model.SessionSummary;
import de.bsommerfeld.gamesync.updater.model.SyncPlan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State of one execution of a {@link SyncPlan}. Owned and mutated by the
 * {@link DownloadOrchestrator}; callers observe it and may cancel, pause or
 * resume it.
 *
 * <p>
 * The table of transfers, keyed by {@link DownloadKey}, lives here rather
 * than in the orchestrator, so its lifetime ends with the session.
 */
public final class DownloadSession {

    private final String sessionId;
    private final SyncPlan plan;
    private final Sandbox sandbox;
    private final SessionControl control = new SessionControl();
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.PENDING);

    private final Set<String> completedFiles = Collections.synchronizedSet(new LinkedHashSet<>());
    private final Map<String, String> failedFiles = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<String> deferredDeletes = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger deleted = new AtomicInteger();
    private final AtomicInteger cancelledFiles = new AtomicInteger();
    private final AtomicLong bytesTransferred = new AtomicLong();
    private final Map<DownloadKey, CompletableFuture<Long>> transfers = new ConcurrentHashMap<>();

    private final CompletableFuture<SessionSummary> completion = new CompletableFuture<>();
    private volatile String failureReason;

    DownloadSession(String sessionId, SyncPlan plan, Sandbox sandbox) {
        this.sessionId = sessionId;
        this.plan = plan;
        this.sandbox = sandbox;
    }

    public String sessionId() {
        return sessionId;
    }

    public SyncPlan plan() {
        return plan;
    }

    public Sandbox sandbox() {
        return sandbox;
    }

    public SessionState state() {
        return state.get();
    }

    public boolean isCancelled() {
        return control.isCancelled();
    }

    /** Requests cooperative cancellation. Completed files are kept. */
    public void cancel() {
        control.cancel();
    }

    /** Holds all transfers at their next chunk boundary until {@link #resume()}. */
    public void pause() {
        control.pause();
    }

    public void resume() {
        control.resume();
    }

    public Set<String> completedFiles() {
        synchronized (completedFiles) {
            return Set.copyOf(completedFiles);
        }
    }

    /** Failed paths mapped to the reason they failed. */
    public Map<String, String> failedFiles() {
        synchronized (failedFiles) {
            return Map.copyOf(failedFiles);
        }
    }

    /** Deletions left for the next session. */
    public List<String> deferredDeletes() {
        synchronized (deferredDeletes) {
            return List.copyOf(deferredDeletes);
        }
    }

    /** Set once the session ended in {@link SessionState#FAILED}. */
    public String failureReason() {
        return failureReason;
    }

    /** Completes with the summary when the session reaches an end state. */
    public CompletableFuture<SessionSummary> completion() {
        return completion.copy();
    }

    /** Blocks until the session ends. */
    public SessionSummary await() throws InterruptedException {
        try {
            return completion.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Session " + sessionId + " ended abnormally", e.getCause());
        }
    }

    /**
     * @throws TimeoutException if the session is still running after the timeout
     */
    public SessionSummary await(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout, unit);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Session " + sessionId + " ended abnormally", e.getCause());
        }
    }

    public SessionSummary summary() {
        return new SessionSummary(
                completedFiles.size(),
                failedFiles.size(),
                cancelledFiles.get(),
                deleted.get(),
                deferredDeletes.size(),
                bytesTransferred.get());
    }

    @Override
    public String toString() {
        return "DownloadSession[" + sessionId + ", " + state.get() + "]";
    }

    // =====================================================================
    // Orchestrator-side mutation
    // =====================================================================

    SessionControl control() {
        return control;
    }

    /**
     * @throws IllegalStateException if the transition is not allowed
     */
    void transition(SessionState next) {
        SessionState current;
        do {
            current = state.get();
            if (!current.canTransitionTo(next))
                throw new IllegalStateException("Session " + sessionId + ": " + current + " -> " + next);
        } while (!state.compareAndSet(current, next));
    }

    /** @return number of completed files including this one */
    int markCompleted(String path, long bytes) {
        bytesTransferred.addAndGet(bytes);
        synchronized (completedFiles) {
            completedFiles.add(path);
            return completedFiles.size();
        }
    }

    void markFailed(String path, String reason) {
        failedFiles.put(path, reason);
    }

    void markCancelled() {
        cancelledFiles.incrementAndGet();
    }

    void markDeleted() {
        deleted.incrementAndGet();
    }

    void deferDelete(String path) {
        deferredDeletes.add(path);
    }

    boolean hasFailures() {
        return !failedFiles.isEmpty();
    }

    void fail(String reason) {
        failureReason = reason;
    }

    void finish() {
        completion.complete(summary());
    }

    /**
     * Claims the transfer for {@code key}. The first caller becomes its owner
     * and must complete the returned future; later callers with the same key
     * get the owner's future and wait on it instead of downloading again.
     */
    Transfer claim(DownloadKey key) {
        CompletableFuture<Long> mine = new CompletableFuture<>();
        CompletableFuture<Long> existing = transfers.putIfAbsent(key, mine);
        return existing == null ? new Transfer(mine, true) : new Transfer(existing, false);
    }

    long pendingTransfers() {
        return transfers.values().stream().filter(f -> !f.isDone()).count();
    }

    record Transfer(CompletableFuture<Long> future, boolean owner) {
    }
}
