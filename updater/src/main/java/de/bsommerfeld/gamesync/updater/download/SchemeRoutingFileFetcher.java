package de.bsommerfeld.gamesync.updater.download;

import java.io.IOException;
import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Dispatches each request to the fetcher registered for its URI scheme.
 */
public final class SchemeRoutingFileFetcher implements FileFetcher {

    private final Map<String, FileFetcher> byScheme = new HashMap<>();

    public SchemeRoutingFileFetcher(List<FileFetcher> fetchers) {
        for (FileFetcher fetcher : fetchers) {
            for (String scheme : fetcher.schemes()) {
                byScheme.put(scheme.toLowerCase(Locale.ROOT), fetcher);
            }
        }
    }

    @Override
    public long fetch(FetchRequest request, DownloadProgressListener listener) throws IOException {
        return route(request.url()).fetch(request, listener);
    }

    @Override
    public String fetchText(URI url, String authToken) throws IOException {
        return route(url).fetchText(url, authToken);
    }

    @Override
    public Set<String> schemes() {
        return Set.copyOf(byScheme.keySet());
    }

    private FileFetcher route(URI url) throws IOException {
        String scheme = url.getScheme();
        FileFetcher fetcher = scheme == null ? null : byScheme.get(scheme.toLowerCase(Locale.ROOT));
        if (fetcher == null)
            throw new IOException("Unsupported URI scheme: " + url);
        return fetcher;
    }
}
