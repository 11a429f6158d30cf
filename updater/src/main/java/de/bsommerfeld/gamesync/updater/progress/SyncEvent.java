package de.bsommerfeld.gamesync.updater.progress;

import de.bsommerfeld.gamesync.updater.model.SessionSummary;

/**
 * Events emitted by a download session. Every event carries the id of the
 * session it belongs to.
 */
public sealed interface SyncEvent {

    String sessionId();

    /** Session end events are never dropped by the channel. */
    default boolean isTerminal() {
        return false;
    }

    /** The plan was accepted and work is about to start. */
    record Queued(String sessionId, int files, long totalBytes) implements SyncEvent {
    }

    record DownloadStarted(String sessionId, String file, long size) implements SyncEvent {
    }

    /**
     * Bytes transferred so far for one file. These are the only events the
     * channel may drop for a slow observer.
     *
     * @param total expected size, or -1 if unknown
     */
    record Progress(String sessionId, String file, long bytes, long total) implements SyncEvent {
    }

    /** A file is in place and matches its manifest hash: {@code completed} of {@code total}. */
    record FileVerified(String sessionId, String file, int completed, int total) implements SyncEvent {
    }

    record FileFailed(String sessionId, String file, String reason) implements SyncEvent {
    }

    record FileDeleted(String sessionId, String file) implements SyncEvent {
    }

    record SessionComplete(String sessionId, SessionSummary summary) implements SyncEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record SessionCancelled(String sessionId, SessionSummary summary) implements SyncEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record SessionFailed(String sessionId, String reason) implements SyncEvent {
        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
