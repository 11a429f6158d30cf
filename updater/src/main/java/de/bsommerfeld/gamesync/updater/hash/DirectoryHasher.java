package de.bsommerfeld.gamesync.updater.hash;

import de.bsommerfeld.gamesync.updater.api.SandboxUnavailableException;
import de.bsommerfeld.gamesync.updater.model.ContentEntry;
import de.bsommerfeld.gamesync.updater.model.DirEntry;
import de.bsommerfeld.gamesync.updater.model.FileEntry;
import de.bsommerfeld.gamesync.updater.model.PathEscapeException;
import de.bsommerfeld.gamesync.updater.model.RelativePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * Walks a directory and produces its content tree.
 *
 * <h3>Determinism</h3>
 * Children are sorted by name and symbolic links are never followed, so two
 * directories with the same structure and bytes yield equal trees regardless
 * of the order the filesystem lists them in.
 *
 * <h3>Failures</h3>
 * An unreadable file or subdirectory is recorded as a {@link HashFailure}
 * and omitted; the walk continues. Only an inaccessible root aborts it.
 * The hasher never writes.
 */
public final class DirectoryHasher {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryHasher.class);

    private final HashOptions options;

    public DirectoryHasher(HashOptions options) {
        this.options = options;
    }

    public HashOptions options() {
        return options;
    }

    /**
     * @throws SandboxUnavailableException if {@code root} is missing, not a
     *                                     directory, or cannot be listed
     */
    public HashedTree hash(Path root) throws SandboxUnavailableException {
        if (!Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS))
            throw new SandboxUnavailableException(root, "Not a directory");

        List<HashFailure> failures = new ArrayList<>();
        TreeMap<String, ContentEntry> children;
        try {
            children = walk(root, RelativePaths.ROOT, failures);
        } catch (IOException e) {
            throw new SandboxUnavailableException(root, "Cannot list directory", e);
        }

        DirEntry tree = new DirEntry(RelativePaths.ROOT, children);
        LOG.debug("Hashed {} ({} files, {} failures)", root, tree.files().size(), failures.size());
        return new HashedTree(tree, failures);
    }

    /** Lists one directory; an IOException here is the caller's to record. */
    private TreeMap<String, ContentEntry> walk(Path dir, String relDir, List<HashFailure> failures)
            throws IOException {
        TreeMap<String, ContentEntry> children = new TreeMap<>();

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                String rel;
                try {
                    rel = RelativePaths.child(relDir, RelativePaths.validateName(name));
                } catch (PathEscapeException e) {
                    failures.add(new HashFailure(RelativePaths.child(relDir, name), e.getMessage()));
                    continue;
                }
                if (options.exclude().matches(rel))
                    continue;

                ContentEntry entry = entryFor(path, rel, failures);
                if (entry != null)
                    children.put(name, entry);
            }
        }
        return children;
    }

    private ContentEntry entryFor(Path path, String rel, List<HashFailure> failures) {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (IOException e) {
            failures.add(new HashFailure(rel, "Cannot read attributes: " + e.getMessage()));
            return null;
        }

        if (attrs.isDirectory()) {
            try {
                return new DirEntry(rel, walk(path, rel, failures));
            } catch (IOException e) {
                LOG.warn("Skipping unreadable directory {}: {}", rel, e.getMessage());
                failures.add(new HashFailure(rel, "Cannot list directory: " + e.getMessage()));
                return null;
            }
        }

        if (!attrs.isRegularFile() || !options.considers(rel))
            return null;

        try {
            String placeholder = options.policy().placeholderFor(rel, attrs.size());
            String hash = placeholder != null ? placeholder : HashUtil.sha256(path);
            return new FileEntry(rel, attrs.size(), hash);
        } catch (IOException e) {
            LOG.warn("Skipping unreadable file {}: {}", rel, e.getMessage());
            failures.add(new HashFailure(rel, "Cannot read file: " + e.getMessage()));
            return null;
        }
    }
}
