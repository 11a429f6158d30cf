package de.bsommerfeld.gamesync.updater.download;

import de.bsommerfeld.gamesync.core.config.DownloadConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Set;

/**
 * {@link FileFetcher} over HTTP(S) built on the JDK {@link HttpClient}.
 *
 * <h3>Redirect handling</h3>
 * The client follows redirects, which mirrors and CDNs rely on.
 *
 * <h3>Authentication</h3>
 * A non-blank token is sent as {@code Authorization: Bearer <token>}.
 *
 * <h3>Timeouts</h3>
 * The configured read timeout bounds the wait for response headers and,
 * through a watchdog, every silence while the body streams. A cancelled
 * session closes the body, so a stalled server cannot hold a worker.
 */
public final class HttpFileFetcher implements FileFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpFileFetcher.class);

    private final HttpClient http;
    private final Duration requestTimeout;

    public HttpFileFetcher(HttpClient http, Duration requestTimeout) {
        this.http = http;
        this.requestTimeout = requestTimeout;
    }

    public static HttpFileFetcher fromConfig(DownloadConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(config.getConnectTimeoutSeconds()))
                .build();
        return new HttpFileFetcher(client, Duration.ofSeconds(config.getReadTimeoutSeconds()));
    }

    @Override
    public long fetch(FetchRequest request, DownloadProgressListener listener) throws IOException {
        HttpResponse<InputStream> response = send(request.url(), request.authToken());
        long totalBytes = response.headers()
                .firstValueAsLong("Content-Length")
                .orElse(-1);

        LOG.debug("Fetching {} ({} bytes)", request.url(), totalBytes);
        try (InputStream in = response.body()) {
            return Transfers.copy(in, request, totalBytes, requestTimeout, listener);
        }
    }

    @Override
    public String fetchText(URI url, String authToken) throws IOException {
        HttpResponse<InputStream> response = send(url, authToken);
        try (InputStream in = response.body()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Override
    public Set<String> schemes() {
        return Set.of("http", "https");
    }

    private HttpResponse<InputStream> send(URI url, String authToken) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(url)
                .timeout(requestTimeout)
                .GET();
        if (authToken != null && !authToken.isBlank())
            builder.header("Authorization", "Bearer " + authToken);

        try {
            HttpResponse<InputStream> response = http.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
            if (!isSuccess(response.statusCode())) {
                response.body().close();
                throw new IOException("HTTP " + response.statusCode() + " for " + url);
            }
            return response;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Download interrupted: " + url, e);
        }
    }

    /** True for the 2xx success range. */
    static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }
}
