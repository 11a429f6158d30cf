package de.bsommerfeld.gamesync.launcher;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.gamesync.core.util.ByteFormatter;
import de.bsommerfeld.gamesync.updater.model.SessionSummary;
import de.bsommerfeld.gamesync.updater.progress.SyncEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Event bus observer that prints a sync session's progress for the console
 * user and mirrors it to the log.
 *
 * <p>
 * Byte-level progress is condensed to one line per started file; the
 * {@link SyncEvent.Progress} stream is only logged at trace level.
 */
public class SyncReporter {

    private static final Logger LOG = LoggerFactory.getLogger(SyncReporter.class);

    private final PrintStream out;
    private final CountDownLatch sessionEnded = new CountDownLatch(1);

    public SyncReporter(PrintStream out) {
        this.out = out;
    }

    @Subscribe
    public void onQueued(SyncEvent.Queued event) {
        print("Syncing %d file(s), %s to download", event.files(), ByteFormatter.format(event.totalBytes()));
    }

    @Subscribe
    public void onStarted(SyncEvent.DownloadStarted event) {
        LOG.debug("Downloading {} ({})", event.file(), ByteFormatter.format(event.size()));
    }

    @Subscribe
    public void onProgress(SyncEvent.Progress event) {
        LOG.trace("{}: {}", event.file(), ByteFormatter.formatProgress(event.bytes(), event.total()));
    }

    @Subscribe
    public void onVerified(SyncEvent.FileVerified event) {
        print("[%d/%d] %s", event.completed(), event.total(), event.file());
    }

    @Subscribe
    public void onFailed(SyncEvent.FileFailed event) {
        print("FAILED %s: %s", event.file(), event.reason());
    }

    @Subscribe
    public void onDeleted(SyncEvent.FileDeleted event) {
        print("Removed %s", event.file());
    }

    @Subscribe
    public void onComplete(SyncEvent.SessionComplete event) {
        print("Sync finished: %s", describe(event.summary()));
        sessionEnded.countDown();
    }

    @Subscribe
    public void onCancelled(SyncEvent.SessionCancelled event) {
        print("Sync cancelled: %s", describe(event.summary()));
        sessionEnded.countDown();
    }

    @Subscribe
    public void onSessionFailed(SyncEvent.SessionFailed event) {
        print("Sync failed: %s", event.reason());
        sessionEnded.countDown();
    }

    /**
     * Events arrive on the progress channel's threads, so the final line may
     * still be pending when the session's future completes.
     *
     * @return {@code false} if no session end was reported within the timeout
     */
    public boolean awaitSessionEnd(long timeout, TimeUnit unit) throws InterruptedException {
        return sessionEnded.await(timeout, unit);
    }

    static String describe(SessionSummary summary) {
        return String.format("%d updated, %d failed, %d removed, %d deferred, %s transferred",
                summary.completed(), summary.failed(), summary.deleted(), summary.deferredDeletes(),
                ByteFormatter.format(summary.bytesTransferred()));
    }

    private void print(String format, Object... args) {
        String line = String.format(format, args);
        LOG.info("{}", line);
        out.println(line);
    }
}
