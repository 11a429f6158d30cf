package de.bsommerfeld.gamesync.updater.download;

import com.sun.net.httpserver.HttpServer;
import de.bsommerfeld.gamesync.core.config.DownloadConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the fetcher against an in-process HTTP server on the loopback
 * interface.
 */
class HttpFileFetcherTest {

    private static final byte[] PAYLOAD = "x".repeat(20_000).getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path dir;

    private HttpServer server;
    private ExecutorService handlers;
    private URI base;
    private final CountDownLatch releaseSilentResponses = new CountDownLatch(1);
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();
    private final HttpFileFetcher fetcher = HttpFileFetcher.fromConfig(new DownloadConfig());

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        handlers = Executors.newCachedThreadPool();
        server.setExecutor(handlers);
        server.createContext("/files/big.bin", exchange -> {
            lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            exchange.sendResponseHeaders(200, PAYLOAD.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(PAYLOAD);
            }
        });
        server.createContext("/files/moved.bin", exchange -> {
            exchange.getResponseHeaders().add("Location", "/files/big.bin");
            exchange.sendResponseHeaders(302, -1);
            exchange.close();
        });
        server.createContext("/files/chunked.bin", exchange -> {
            // length 0 selects chunked encoding, so no Content-Length is sent
            exchange.sendResponseHeaders(200, 0);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(PAYLOAD);
            }
        });
        server.createContext("/files/silent.bin", exchange -> {
            exchange.sendResponseHeaders(200, 100);
            OutputStream out = exchange.getResponseBody();
            out.write(new byte[10]);
            out.flush();
            try {
                releaseSilentResponses.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.close();
        });
        server.createContext("/manifest.json", exchange -> {
            byte[] body = "{\"manifest\":{}}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        base = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    @AfterEach
    void stopServer() {
        releaseSilentResponses.countDown();
        server.stop(0);
        handlers.shutdownNow();
    }

    @Test
    void fetch_shouldStreamBodyAndReportProgress() throws IOException {
        Path target = dir.resolve("big.bin.part");
        AtomicLong lastReported = new AtomicLong();

        long written = fetcher.fetch(new FetchRequest(base.resolve("/files/big.bin"), target, null, new SessionControl()),
                (read, total) -> {
                    lastReported.set(read);
                    assertEquals(PAYLOAD.length, total);
                });

        assertEquals(PAYLOAD.length, written);
        assertEquals(PAYLOAD.length, lastReported.get());
        assertArrayEquals(PAYLOAD, Files.readAllBytes(target));
        assertNull(lastAuthorization.get());
    }

    @Test
    void fetch_shouldSendBearerToken() throws IOException {
        fetcher.fetch(new FetchRequest(base.resolve("/files/big.bin"), dir.resolve("t"), "s3cret", new SessionControl()),
                DownloadProgressListener.NONE);

        assertEquals("Bearer s3cret", lastAuthorization.get());
    }

    @Test
    void fetch_shouldFollowRedirects() throws IOException {
        Path target = dir.resolve("moved.bin");

        fetcher.fetch(new FetchRequest(base.resolve("/files/moved.bin"), target, null, new SessionControl()),
                DownloadProgressListener.NONE);

        assertEquals(PAYLOAD.length, Files.size(target));
    }

    @Test
    void fetch_shouldFailForMissingFile() {
        IOException e = assertThrows(IOException.class, () -> fetcher.fetch(
                new FetchRequest(base.resolve("/files/missing.bin"), dir.resolve("m"), null, new SessionControl()),
                DownloadProgressListener.NONE));
        assertTrue(e.getMessage().contains("404"));
    }

    @Test
    void fetch_shouldStopWhenCancelled() {
        SessionControl control = new SessionControl();
        control.cancel();

        assertThrows(CancellationException.class, () -> fetcher.fetch(
                new FetchRequest(base.resolve("/files/big.bin"), dir.resolve("c"), null, control),
                DownloadProgressListener.NONE));
    }

    @Test
    void fetch_shouldReturnWhenCancelledDuringSilentRead() throws Exception {
        SessionControl control = new SessionControl();
        CountDownLatch firstBytes = new CountDownLatch(1);
        HttpFileFetcher patient = new HttpFileFetcher(HttpClient.newHttpClient(), Duration.ofSeconds(30));
        ExecutorService runner = Executors.newSingleThreadExecutor();
        try {
            Future<Long> transfer = runner.submit(() -> patient.fetch(
                    new FetchRequest(base.resolve("/files/silent.bin"), dir.resolve("s.part"), null, control),
                    (read, total) -> firstBytes.countDown()));
            assertTrue(firstBytes.await(10, TimeUnit.SECONDS));

            control.cancel();

            ExecutionException e = assertThrows(ExecutionException.class, () -> transfer.get(5, TimeUnit.SECONDS));
            assertInstanceOf(CancellationException.class, e.getCause());
            assertEquals(0, control.inFlightCount());
        } finally {
            runner.shutdownNow();
        }
    }

    @Test
    void fetch_shouldTimeOutWhenServerGoesSilent() {
        HttpFileFetcher impatient = new HttpFileFetcher(HttpClient.newHttpClient(), Duration.ofMillis(500));

        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> assertThrows(SocketTimeoutException.class,
                () -> impatient.fetch(new FetchRequest(base.resolve("/files/silent.bin"), dir.resolve("t.part"), null,
                        new SessionControl()), DownloadProgressListener.NONE)));
    }

    @Test
    void fetch_shouldRejectAnnouncedLengthAboveExpectedSize() {
        Path target = dir.resolve("big.bin.part");

        assertThrows(HashMismatchException.class, () -> fetcher.fetch(
                new FetchRequest(base.resolve("/files/big.bin"), target, null, new SessionControl(), 100),
                DownloadProgressListener.NONE));
        assertFalse(Files.exists(target));
    }

    @Test
    void fetch_shouldStopStreamingPastExpectedSize() throws IOException {
        Path target = dir.resolve("chunked.bin.part");
        AtomicLong lastReported = new AtomicLong();

        HashMismatchException e = assertThrows(HashMismatchException.class, () -> fetcher.fetch(
                new FetchRequest(base.resolve("/files/chunked.bin"), target, null, new SessionControl(), 100),
                (read, total) -> lastReported.set(read)));

        assertTrue(e.getMessage().startsWith("Size exceeded"));
        assertTrue(Files.size(target) <= 100);
        assertTrue(lastReported.get() <= 100);
    }

    @Test
    void fetch_shouldAcceptBodyOfExactlyExpectedSize() throws IOException {
        long written = fetcher.fetch(new FetchRequest(base.resolve("/files/chunked.bin"), dir.resolve("ok.part"), null,
                new SessionControl(), PAYLOAD.length), DownloadProgressListener.NONE);

        assertEquals(PAYLOAD.length, written);
    }

    @Test
    void fetchText_shouldReturnBody() throws IOException {
        assertEquals("{\"manifest\":{}}", fetcher.fetchText(base.resolve("/manifest.json"), null));
    }

    @Test
    void isSuccess_shouldAcceptOnly2xx() {
        assertTrue(HttpFileFetcher.isSuccess(200));
        assertTrue(HttpFileFetcher.isSuccess(204));
        assertTrue(HttpFileFetcher.isSuccess(299));
        assertFalse(HttpFileFetcher.isSuccess(199));
        assertFalse(HttpFileFetcher.isSuccess(300));
        assertFalse(HttpFileFetcher.isSuccess(404));
    }
}
