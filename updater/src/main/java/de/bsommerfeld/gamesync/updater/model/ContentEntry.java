package de.bsommerfeld.gamesync.updater.model;

/**
 * A node of a content tree: either a file with its digest or a directory
 * with named children.
 */
public sealed interface ContentEntry permits FileEntry, DirEntry {

    /** Forward-slash path relative to the content root; empty for the root. */
    String relativePath();

    /** Last segment of {@link #relativePath()}. */
    default String name() {
        return RelativePaths.name(relativePath());
    }
}
