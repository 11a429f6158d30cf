package de.bsommerfeld.gamesync.updater.download;

import java.io.IOException;
import java.net.URI;
import java.util.Set;

/**
 * Transport used by the orchestrator. Implementations write exactly the bytes
 * they read to the request's destination and nothing else; verification and
 * placement are the caller's job.
 */
public interface FileFetcher {

    /**
     * @return number of bytes written
     * @throws IOException                                 on transport or disk errors
     * @throws java.util.concurrent.CancellationException if the request's
     *                                                     control was cancelled
     */
    long fetch(FetchRequest request, DownloadProgressListener listener) throws IOException;

    /** Reads a small UTF-8 document such as a manifest. */
    String fetchText(URI url, String authToken) throws IOException;

    /** URI schemes this fetcher understands. */
    Set<String> schemes();
}
