package de.bsommerfeld.gamesync.updater.download;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * {@link FileFetcher} for {@code file:} URIs, used for local mirrors and
 * removable media. Tokens are ignored.
 */
public final class LocalFileFetcher implements FileFetcher {

    @Override
    public long fetch(FetchRequest request, DownloadProgressListener listener) throws IOException {
        Path source = toPath(request.url());
        long totalBytes = Files.size(source);
        try (InputStream in = Files.newInputStream(source)) {
            return Transfers.copy(in, request, totalBytes, null, listener);
        }
    }

    @Override
    public String fetchText(URI url, String authToken) throws IOException {
        return Files.readString(toPath(url), StandardCharsets.UTF_8);
    }

    @Override
    public Set<String> schemes() {
        return Set.of("file");
    }

    private static Path toPath(URI url) throws IOException {
        if (!"file".equalsIgnoreCase(url.getScheme()))
            throw new IOException("Not a file URI: " + url);
        return Path.of(url);
    }
}
