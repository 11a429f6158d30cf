package de.bsommerfeld.gamesync.launcher;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the game JVM described by a {@link LaunchSpec} and waits for it.
 *
 * <h3>Output</h3>
 * Standard output and standard error are read line by line on two pump
 * threads, handed to the {@link OutputListener} as they arrive and kept for
 * the {@link ProcessResult}. At most {@link #MAX_CAPTURED_LINES} lines per
 * stream are kept; the listener still sees every line.
 *
 * <h3>Timeout</h3>
 * A process that outlives the timeout is killed forcibly and reported with
 * {@link ProcessResult#timedOut()}.
 */
public final class GameProcess {

    private static final Logger LOG = LoggerFactory.getLogger(GameProcess.class);

    static final int MAX_CAPTURED_LINES = 10_000;

    /** Receives process output lines as they are read. */
    @FunctionalInterface
    public interface OutputListener {

        void onLine(boolean error, String line);

        OutputListener NONE = (error, line) -> {
        };
    }

    private final Duration timeout;

    public GameProcess(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * @throws IOException          if the process cannot be started
     * @throws InterruptedException if interrupted while waiting; the process is killed
     */
    public ProcessResult run(LaunchSpec spec, OutputListener listener) throws IOException, InterruptedException {
        List<String> command = spec.command();
        LOG.info("Starting {} in {}", spec.mainClass(), spec.workingDir());
        LOG.debug("Command: {}", command);

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(spec.workingDir().toFile());
        Process process = pb.start();

        ExecutorService pumps = Executors.newFixedThreadPool(2,
                new ThreadFactoryBuilder().setNameFormat("game-output-%d").setDaemon(true).build());
        try {
            Future<List<String>> out = pumps.submit(() -> pump(process.getInputStream(), false, listener));
            Future<List<String>> err = pumps.submit(() -> pump(process.getErrorStream(), true, listener));

            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }
            if (!finished) {
                LOG.warn("{} did not exit within {}, killing it", spec.mainClass(), timeout);
                process.destroyForcibly().waitFor();
            }

            ProcessResult result = new ProcessResult(finished ? process.exitValue() : -1,
                    collect(out), collect(err), !finished);
            LOG.info("{} exited with code {}", spec.mainClass(), result.exitCode());
            return result;
        } finally {
            pumps.shutdownNow();
        }
    }

    private static List<String> pump(InputStream stream, boolean error, OutputListener listener) {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (lines.size() < MAX_CAPTURED_LINES)
                    lines.add(line);
                try {
                    listener.onLine(error, line);
                } catch (RuntimeException e) {
                    LOG.warn("Output listener failed", e);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return lines;
    }

    private static List<String> collect(Future<List<String>> lines) throws InterruptedException {
        try {
            return lines.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            LOG.warn("Could not read process output: {}", e.getCause().getMessage());
        } catch (TimeoutException e) {
            LOG.warn("Process output still open after exit");
        }
        return Collections.emptyList();
    }
}
