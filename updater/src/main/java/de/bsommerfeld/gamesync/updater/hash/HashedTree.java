package de.bsommerfeld.gamesync.updater.hash;

import de.bsommerfeld.gamesync.updater.model.DirEntry;

import java.util.List;

/**
 * Result of hashing a directory: the tree of everything readable plus the
 * entries that had to be skipped.
 */
public record HashedTree(DirEntry root, List<HashFailure> failures) {

    public HashedTree {
        failures = List.copyOf(failures);
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
