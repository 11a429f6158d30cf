package de.bsommerfeld.gamesync.updater.api;

import java.nio.file.Path;

/**
 * The sandbox root does not exist, is not a directory, or cannot be read.
 */
public class SandboxUnavailableException extends SyncException {

    private final transient Path root;

    public SandboxUnavailableException(Path root, String message) {
        super(message + ": " + root);
        this.root = root;
    }

    public SandboxUnavailableException(Path root, String message, Throwable cause) {
        super(message + ": " + root, cause);
        this.root = root;
    }

    public Path root() {
        return root;
    }
}
