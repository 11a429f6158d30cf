package de.bsommerfeld.gamesync.updater.model;

/**
 * Outcome counts of a finished download session.
 *
 * @param completed        files fetched or verified successfully
 * @param failed           files that could not be fetched or verified
 * @param cancelled        files left unprocessed because the session was cancelled
 * @param deleted          local files removed
 * @param deferredDeletes  deletions skipped or failed, retried by the next sync
 * @param bytesTransferred bytes written to the sandbox by successful fetches
 */
public record SessionSummary(int completed, int failed, int cancelled, int deleted, int deferredDeletes,
        long bytesTransferred) {

    public boolean isClean() {
        return failed == 0 && cancelled == 0 && deferredDeletes == 0;
    }
}
