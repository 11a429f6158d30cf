package de.bsommerfeld.gamesync.updater.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A directory in a content tree. Children are kept sorted by name so that
 * every traversal, serialization and signature sees the same order.
 *
 * <p>
 * Construction validates the whole subtree shape: each child must be keyed
 * by its own name and carry the path {@code parent/name}. A tree assembled
 * from untrusted input therefore cannot hold a path that escapes its root.
 */
public record DirEntry(String relativePath, SortedMap<String, ContentEntry> children) implements ContentEntry {

    public DirEntry {
        RelativePaths.validate(relativePath);
        TreeMap<String, ContentEntry> copy = new TreeMap<>();
        for (Map.Entry<String, ContentEntry> e : children.entrySet()) {
            String name = RelativePaths.validateName(e.getKey());
            ContentEntry child = e.getValue();
            String expected = RelativePaths.child(relativePath, name);
            if (!child.relativePath().equals(expected))
                throw new PathEscapeException(child.relativePath(),
                        "Child path does not match its position (expected '" + expected + "')");
            copy.put(name, child);
        }
        children = Collections.unmodifiableSortedMap(copy);
    }

    /** An empty directory at the content root. */
    public static DirEntry emptyRoot() {
        return new DirEntry(RelativePaths.ROOT, new TreeMap<>());
    }

    /** All files below this directory in sorted pre-order. */
    public List<FileEntry> files() {
        List<FileEntry> out = new ArrayList<>();
        collectFiles(this, out);
        return out;
    }

    private static void collectFiles(DirEntry dir, List<FileEntry> out) {
        for (ContentEntry child : dir.children().values()) {
            if (child instanceof FileEntry file) {
                out.add(file);
            } else if (child instanceof DirEntry sub) {
                collectFiles(sub, out);
            }
        }
    }
}
