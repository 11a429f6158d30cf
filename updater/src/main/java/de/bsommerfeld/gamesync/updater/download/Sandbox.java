package de.bsommerfeld.gamesync.updater.download;

import de.bsommerfeld.gamesync.updater.api.SandboxUnavailableException;
import de.bsommerfeld.gamesync.updater.model.PathEscapeException;
import de.bsommerfeld.gamesync.updater.model.RelativePaths;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * The one directory a session may write to. Every relative path is resolved
 * and checked here right before the filesystem is touched, independent of
 * the validation the content model already did.
 */
public final class Sandbox {

    private final Path root;

    public Sandbox(Path root) {
        if (!root.isAbsolute())
            throw new IllegalArgumentException("Sandbox root must be absolute: " + root);
        this.root = root.normalize();
    }

    public Path root() {
        return root;
    }

    /**
     * @throws PathEscapeException if the path is malformed or resolves to the
     *                             root itself or anywhere outside it
     */
    public Path resolve(String relativePath) {
        RelativePaths.validate(relativePath);
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root))
            throw new PathEscapeException(relativePath, "Resolves outside the sandbox root");
        return resolved;
    }

    /**
     * Rejects a target whose parent chain inside the sandbox contains a
     * symbolic link, since writing through it could land outside the root.
     */
    public void requireNoLinks(Path target) {
        Path current = target.getParent();
        while (current != null && current.startsWith(root) && !current.equals(root)) {
            if (Files.isSymbolicLink(current))
                throw new PathEscapeException(root.relativize(target).toString(),
                        "Symbolic link in path at " + root.relativize(current));
            current = current.getParent();
        }
    }

    /**
     * @throws SandboxUnavailableException if the root is missing, not a
     *                                     directory or not writable
     */
    public void requireAccessible() throws SandboxUnavailableException {
        if (!Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS))
            throw new SandboxUnavailableException(root, "Sandbox root is not a directory");
        if (!Files.isWritable(root))
            throw new SandboxUnavailableException(root, "Sandbox root is not writable");
    }

    @Override
    public String toString() {
        return "Sandbox[" + root + "]";
    }
}
