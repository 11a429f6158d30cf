package de.bsommerfeld.gamesync.updater.progress;

/**
 * Receives session events from a {@link ProgressChannel}. Calls for one
 * listener never overlap and arrive in publish order.
 */
@FunctionalInterface
public interface ProgressListener {

    void onEvent(SyncEvent event);
}
