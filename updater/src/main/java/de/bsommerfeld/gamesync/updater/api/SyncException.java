package de.bsommerfeld.gamesync.updater.api;

/**
 * Thrown when a sync cannot proceed at all. Failures of individual files
 * are reported through the session instead.
 */
public class SyncException extends Exception {

    public SyncException(String message) {
        super(message);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
