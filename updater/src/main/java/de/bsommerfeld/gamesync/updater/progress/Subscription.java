package de.bsommerfeld.gamesync.updater.progress;

/**
 * Handle returned by {@link ProgressChannel#subscribe}. Closing it stops
 * delivery; events already queued for the listener are discarded.
 */
public interface Subscription extends AutoCloseable {

    /** Progress events dropped for this subscriber because it fell behind. */
    long droppedProgressEvents();

    @Override
    void close();
}
