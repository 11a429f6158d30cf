package de.bsommerfeld.gamesync.core.util;

import java.util.Locale;

/**
 * Formats byte counts for progress output (e.g. "14.3 MB").
 */
public final class ByteFormatter {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private ByteFormatter() {
    }

    public static String format(long bytes) {
        if (bytes < 0)
            return "? B";

        double value = bytes;
        int unitIdx = 0;
        while (value >= 1024 && unitIdx < UNITS.length - 1) {
            value /= 1024;
            unitIdx++;
        }

        if (unitIdx == 0)
            return bytes + " B";
        return String.format(Locale.ROOT, "%.1f %s", value, UNITS[unitIdx]);
    }

    /** Formats a transfer as {@code "3.2 MB / 12.4 MB"}, or just the done part if the total is unknown. */
    public static String formatProgress(long done, long total) {
        if (total <= 0)
            return format(done);
        return format(done) + " / " + format(total);
    }
}
