package de.bsommerfeld.gamesync.updater.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A single file in a content tree.
 *
 * @param relativePath forward-slash path relative to the content root
 * @param size         file size in bytes
 * @param contentHash  lowercase hex-encoded SHA-256 digest
 */
public record FileEntry(String relativePath, long size, String contentHash) implements ContentEntry {

    private static final int HASH_LENGTH = 64;

    public FileEntry {
        RelativePaths.validate(relativePath);
        if (relativePath.isEmpty())
            throw new PathEscapeException(relativePath, "File entry without a name");
        if (size < 0)
            throw new IllegalArgumentException("Negative size for " + relativePath + ": " + size);
        Objects.requireNonNull(contentHash, "contentHash");
        contentHash = contentHash.toLowerCase(Locale.ROOT);
        if (contentHash.length() != HASH_LENGTH || !isHex(contentHash))
            throw new IllegalArgumentException("Malformed content hash for " + relativePath + ": " + contentHash);
    }

    private static boolean isHex(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if ((c < '0' || c > '9') && (c < 'a' || c > 'f'))
                return false;
        }
        return true;
    }
}
