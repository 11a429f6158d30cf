package de.bsommerfeld.gamesync.updater.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Expected content of one content root at publish time.
 *
 * @param root          tree rooted at the empty path
 * @param generatedAt   publish timestamp
 * @param contentScope  which content root this manifest describes
 */
public record Manifest(DirEntry root, Instant generatedAt, ContentScope contentScope) {

    public Manifest {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(generatedAt, "generatedAt");
        Objects.requireNonNull(contentScope, "contentScope");
        if (!root.relativePath().isEmpty())
            throw new IllegalArgumentException("Manifest root must have the empty path, got '" + root.relativePath() + "'");
    }
}
