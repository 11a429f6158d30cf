package de.bsommerfeld.gamesync.updater.manifest;

import de.bsommerfeld.gamesync.updater.api.SyncException;

/**
 * The manifest signature does not match its content or the trusted key.
 * Nothing from such a manifest may be used.
 */
public class SignatureInvalidException extends SyncException {

    public SignatureInvalidException(String message) {
        super(message);
    }

    public SignatureInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
