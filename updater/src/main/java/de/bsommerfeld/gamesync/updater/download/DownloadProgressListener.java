package de.bsommerfeld.gamesync.updater.download;

/**
 * Callback for tracking the bytes of a single transfer.
 */
@FunctionalInterface
public interface DownloadProgressListener {

    DownloadProgressListener NONE = (bytesRead, totalBytes) -> {
    };

    /**
     * Called after every chunk written to the destination.
     *
     * @param bytesRead  bytes transferred so far
     * @param totalBytes total expected size, or -1 if unknown
     */
    void onProgress(long bytesRead, long totalBytes);
}
