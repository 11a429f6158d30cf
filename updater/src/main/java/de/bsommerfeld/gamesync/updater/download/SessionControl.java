package de.bsommerfeld.gamesync.updater.download;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cooperative cancel and pause switch shared by all transfers of one
 * session. Workers call {@link #checkpoint()} between chunks and between
 * files. A transfer blocked inside a read is released by closing its
 * stream, which {@link #cancel()} does for every stream registered through
 * {@link #track(Closeable)}.
 */
public final class SessionControl {

    private static final Logger LOG = LoggerFactory.getLogger(SessionControl.class);

    private final Object lock = new Object();
    private final Set<Closeable> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelled;
    private boolean paused;

    public void cancel() {
        cancelled = true;
        synchronized (lock) {
            lock.notifyAll();
        }
        inFlight.forEach(SessionControl::closeQuietly);
    }

    /**
     * Registers a stream to be closed on cancellation until the returned
     * handle is closed. A stream tracked after cancellation is closed at once.
     */
    public Tracked track(Closeable stream) {
        inFlight.add(stream);
        if (cancelled)
            closeQuietly(stream);
        return () -> inFlight.remove(stream);
    }

    /** Number of streams currently tracked. */
    int inFlightCount() {
        return inFlight.size();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void pause() {
        synchronized (lock) {
            paused = true;
        }
    }

    public void resume() {
        synchronized (lock) {
            paused = false;
            lock.notifyAll();
        }
    }

    public boolean isPaused() {
        synchronized (lock) {
            return paused;
        }
    }

    /**
     * Blocks while paused and throws once cancelled. An interrupt is treated
     * as cancellation of the calling transfer.
     *
     * @throws CancellationException if the session was cancelled
     */
    public void checkpoint() {
        if (cancelled)
            throw new CancellationException("Session cancelled");
        synchronized (lock) {
            while (paused && !cancelled) {
                try {
                    lock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while paused");
                }
            }
        }
        if (cancelled)
            throw new CancellationException("Session cancelled");
    }

    private static void closeQuietly(Closeable stream) {
        try {
            stream.close();
        } catch (IOException e) {
            LOG.debug("Closing cancelled stream failed: {}", e.getMessage());
        }
    }

    /** Registration handle returned by {@link #track(Closeable)}. */
    @FunctionalInterface
    public interface Tracked extends AutoCloseable {
        @Override
        void close();
    }
}
