package de.bsommerfeld.gamesync.updater.manifest;

/**
 * Thrown when manifest JSON does not match the expected structure.
 */
public class ManifestFormatException extends RuntimeException {

    public ManifestFormatException(String message) {
        super(message);
    }

    public ManifestFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
