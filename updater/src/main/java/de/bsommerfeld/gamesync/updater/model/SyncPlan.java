package de.bsommerfeld.gamesync.updater.model;

import java.util.List;

/**
 * Operations needed to reconcile a local tree with a manifest.
 *
 * @param toFetch  files to download (missing locally or with a different hash)
 * @param toVerify files whose local copy matches but must be re-hashed
 * @param toDelete local-only paths to remove once everything else succeeded
 */
public record SyncPlan(List<FileEntry> toFetch, List<FileEntry> toVerify, List<String> toDelete) {

    public SyncPlan {
        toFetch = List.copyOf(toFetch);
        toVerify = List.copyOf(toVerify);
        toDelete = List.copyOf(toDelete);
    }

    public static SyncPlan empty() {
        return new SyncPlan(List.of(), List.of(), List.of());
    }

    /** True if the plan contains no operations at all. */
    public boolean isEmpty() {
        return toFetch.isEmpty() && toVerify.isEmpty() && toDelete.isEmpty();
    }

    public int totalChanges() {
        return toFetch.size() + toDelete.size();
    }

    public long bytesToFetch() {
        return toFetch.stream().mapToLong(FileEntry::size).sum();
    }
}
