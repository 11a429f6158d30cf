package de.bsommerfeld.gamesync.updater.api;

import de.bsommerfeld.gamesync.updater.download.SessionState;
import de.bsommerfeld.gamesync.updater.hash.HashFailure;
import de.bsommerfeld.gamesync.updater.model.Manifest;
import de.bsommerfeld.gamesync.updater.model.SessionSummary;
import de.bsommerfeld.gamesync.updater.model.SyncPlan;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a full client sync.
 *
 * @param localHashFailures local entries that could not be read before diffing
 */
public record SyncResult(
        Manifest manifest,
        SyncPlan plan,
        String sessionId,
        SessionState state,
        SessionSummary summary,
        Map<String, String> failedFiles,
        List<HashFailure> localHashFailures) {

    public SyncResult {
        failedFiles = Map.copyOf(failedFiles);
        localHashFailures = List.copyOf(localHashFailures);
    }

    /** True if the sandbox now matches the manifest in full. */
    public boolean isUpToDate() {
        return state == SessionState.COMPLETED && summary.failed() == 0;
    }
}
