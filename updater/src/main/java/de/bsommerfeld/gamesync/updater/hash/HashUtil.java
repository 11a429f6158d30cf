package de.bsommerfeld.gamesync.updater.hash;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * SHA-256 hashing utility. Uses streaming I/O to handle arbitrarily large files
 * without loading them entirely into memory.
 */
public final class HashUtil {

    private static final String ALGORITHM = "SHA-256";
    private static final int BUFFER_SIZE = 8192;
    private static final String FAST_CHECK_PREFIX = "fast-check:";

    private HashUtil() {
    }

    /**
     * Computes the hex-encoded SHA-256 hash of the given file.
     *
     * @throws IOException if the file cannot be read
     */
    public static String sha256(Path file) throws IOException {
        MessageDigest digest = newDigest();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /** Computes the hex-encoded SHA-256 hash of a raw byte array. */
    public static String sha256(byte[] data) {
        MessageDigest digest = newDigest();
        digest.update(data);
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Digest recorded for files whose content is not read. Depends only on
     * the size, so a size change is still detected.
     */
    public static String sizePlaceholder(long size) {
        return sha256((FAST_CHECK_PREFIX + size).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Compares two hex digests in constant time with respect to their content.
     * Case-insensitive; {@code null} never matches.
     */
    public static boolean matches(String expected, String actual) {
        if (expected == null || actual == null)
            return false;
        byte[] a = expected.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        byte[] b = actual.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(a, b);
    }

    /** A fresh SHA-256 digest for incremental hashing while streaming. */
    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every JVM ships SHA-256
            throw new AssertionError(ALGORITHM + " not available", e);
        }
    }
}
