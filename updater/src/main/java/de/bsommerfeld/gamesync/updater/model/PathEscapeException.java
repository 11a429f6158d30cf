package de.bsommerfeld.gamesync.updater.model;

/**
 * Thrown when a relative path would resolve outside its content root, either
 * because it is malformed ({@code ..}, absolute prefixes) or because a resolved
 * filesystem path left the sandbox.
 */
public class PathEscapeException extends RuntimeException {

    private final String path;

    public PathEscapeException(String path, String message) {
        super(message + ": '" + path + "'");
        this.path = path;
    }

    /** The offending path exactly as it was supplied. */
    public String path() {
        return path;
    }
}
