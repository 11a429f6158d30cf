package de.bsommerfeld.gamesync.updater.download;

import java.net.URI;
import java.nio.file.Path;

/**
 * Identity of one transfer within a session. Requests with the same source
 * and destination share a single in-flight download.
 */
public record DownloadKey(URI url, Path destination) {
}
