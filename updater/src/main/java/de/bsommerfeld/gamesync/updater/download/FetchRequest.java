package de.bsommerfeld.gamesync.updater.download;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One transfer: read {@code url} and write its bytes to {@code destination}.
 *
 * @param authToken    bearer token, or {@code null} for anonymous access
 * @param control      checked between chunks
 * @param expectedSize upper bound on the bytes accepted, or {@link #UNKNOWN_SIZE}
 */
public record FetchRequest(URI url, Path destination, String authToken, SessionControl control, long expectedSize) {

    public static final long UNKNOWN_SIZE = -1;

    public FetchRequest {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(control, "control");
        if (expectedSize < UNKNOWN_SIZE)
            throw new IllegalArgumentException("expectedSize must be >= 0 or UNKNOWN_SIZE: " + expectedSize);
    }

    public FetchRequest(URI url, Path destination, String authToken, SessionControl control) {
        this(url, destination, authToken, control, UNKNOWN_SIZE);
    }

    public boolean hasExpectedSize() {
        return expectedSize != UNKNOWN_SIZE;
    }

    @Override
    public String toString() {
        // the token stays out of logs
        return "FetchRequest[" + url + " -> " + destination + "]";
    }
}
