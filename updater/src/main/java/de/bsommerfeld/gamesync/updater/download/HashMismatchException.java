package de.bsommerfeld.gamesync.updater.download;

import java.io.IOException;

/**
 * Downloaded bytes did not match the manifest, either after the transfer or
 * as soon as a transfer ran past the expected size.
 */
public class HashMismatchException extends IOException {

    public HashMismatchException(String message) {
        super(message);
    }
}
