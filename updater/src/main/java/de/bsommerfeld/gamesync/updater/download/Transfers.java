package de.bsommerfeld.gamesync.updater.download;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketTimeoutException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/** Chunked stream copy shared by the fetchers. */
final class Transfers {

    private static final Logger LOG = LoggerFactory.getLogger(Transfers.class);

    private static final int BUFFER_SIZE = 8192;

    private static final ScheduledExecutorService WATCHDOG = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("gamesync-read-watchdog-%d").setDaemon(true).build());

    private Transfers() {
    }

    /**
     * Streams bytes from the input to the request's destination while
     * reporting progress. The control is consulted before the first and after
     * every chunk, and cancelling it closes the input so a blocked read
     * returns.
     *
     * <h3>Limits</h3>
     * No more than {@link FetchRequest#expectedSize()} bytes are written; the
     * first chunk past it fails the transfer with a
     * {@link HashMismatchException}. With a read timeout, a watchdog closes
     * the input once no byte arrived for that long.
     *
     * @param totalBytes  announced length, or {@code -1}
     * @param readTimeout longest silence between two reads, {@code null} for none
     */
    static long copy(InputStream in, FetchRequest request, long totalBytes, Duration readTimeout,
            DownloadProgressListener listener) throws IOException {
        SessionControl control = request.control();
        control.checkpoint();
        if (request.hasExpectedSize() && totalBytes > request.expectedSize())
            throw sizeExceeded(request, totalBytes);

        StallWatch watch = readTimeout == null ? null : StallWatch.start(in, control, readTimeout);
        try (SessionControl.Tracked tracked = control.track(in);
             OutputStream out = Files.newOutputStream(request.destination())) {
            byte[] buffer = new byte[BUFFER_SIZE];
            long transferred = 0;
            while (true) {
                int read;
                try {
                    read = in.read(buffer);
                } catch (IOException e) {
                    failIfClosedByUs(control, watch);
                    throw e;
                }
                if (read == -1)
                    break;

                transferred += read;
                if (request.hasExpectedSize() && transferred > request.expectedSize())
                    throw sizeExceeded(request, transferred);
                out.write(buffer, 0, read);
                listener.onProgress(transferred, totalBytes);
                control.checkpoint();
                if (watch != null)
                    watch.touch();
            }
            // a stream closed underneath the read reports end of data
            failIfClosedByUs(control, watch);
            return transferred;
        } finally {
            if (watch != null)
                watch.stop();
        }
    }

    private static void failIfClosedByUs(SessionControl control, StallWatch watch) throws IOException {
        if (control.isCancelled())
            throw new CancellationException("Session cancelled");
        if (watch != null && watch.stalled())
            throw new SocketTimeoutException("No data received for " + watch.timeout.toMillis() + " ms");
    }

    private static HashMismatchException sizeExceeded(FetchRequest request, long bytes) {
        return new HashMismatchException("Size exceeded (expected " + request.expectedSize() + ", got at least "
                + bytes + ")");
    }

    /** Closes a stream that has been silent for longer than the timeout. */
    private static final class StallWatch implements Runnable {

        private final Closeable stream;
        private final SessionControl control;
        private final Duration timeout;
        private volatile long lastActivity = System.nanoTime();
        private volatile boolean stalled;
        private ScheduledFuture<?> task;

        private StallWatch(Closeable stream, SessionControl control, Duration timeout) {
            this.stream = stream;
            this.control = control;
            this.timeout = timeout;
        }

        static StallWatch start(Closeable stream, SessionControl control, Duration timeout) {
            StallWatch watch = new StallWatch(stream, control, timeout);
            long period = Math.max(10, timeout.toMillis() / 4);
            watch.task = WATCHDOG.scheduleWithFixedDelay(watch, period, period, TimeUnit.MILLISECONDS);
            return watch;
        }

        void touch() {
            lastActivity = System.nanoTime();
        }

        boolean stalled() {
            return stalled;
        }

        void stop() {
            task.cancel(false);
        }

        @Override
        public void run() {
            // a paused session is not silent, it is waiting for us
            if (control.isPaused()) {
                touch();
                return;
            }
            if (stalled || System.nanoTime() - lastActivity < timeout.toNanos())
                return;
            stalled = true;
            LOG.debug("No data for {}, closing stream", timeout);
            try {
                stream.close();
            } catch (IOException e) {
                LOG.debug("Closing stalled stream failed: {}", e.getMessage());
            }
        }
    }
}
