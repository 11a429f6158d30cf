package de.bsommerfeld.gamesync.updater.progress;

import com.google.common.util.concurrent.MoreExecutors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fan-out of session events to any number of listeners without letting a
 * listener slow down the publisher.
 *
 * <h3>Delivery</h3>
 * Each subscriber gets its own lane, a sequential executor on top of the
 * shared executor, so one listener sees events in publish order and never
 * concurrently. Different listeners run independently.
 *
 * <h3>Backpressure</h3>
 * {@link #publish} only enqueues. When a lane already holds
 * {@code progressQueueLimit} undelivered {@link SyncEvent.Progress} events,
 * further progress events for that lane are dropped. All other events are
 * always enqueued, so every subscriber sees each file's start, result and
 * the session's end.
 *
 * <h3>Failures</h3>
 * A listener that throws is logged and keeps its subscription; the
 * exception never reaches the publisher.
 */
public final class ProgressChannel {

    private static final Logger LOG = LoggerFactory.getLogger(ProgressChannel.class);

    private final Executor executor;
    private final int progressQueueLimit;
    private final List<Lane> lanes = new CopyOnWriteArrayList<>();

    public ProgressChannel(Executor executor, int progressQueueLimit) {
        if (progressQueueLimit < 1)
            throw new IllegalArgumentException("progressQueueLimit must be positive: " + progressQueueLimit);
        this.executor = executor;
        this.progressQueueLimit = progressQueueLimit;
    }

    public Subscription subscribe(ProgressListener listener) {
        Lane lane = new Lane(listener, MoreExecutors.newSequentialExecutor(executor));
        lanes.add(lane);
        return lane;
    }

    public void publish(SyncEvent event) {
        for (Lane lane : lanes) {
            lane.offer(event);
        }
    }

    public int subscriberCount() {
        return lanes.size();
    }

    private final class Lane implements Subscription {

        private final ProgressListener listener;
        private final Executor sequential;
        private final AtomicInteger pendingProgress = new AtomicInteger();
        private final AtomicLong dropped = new AtomicLong();
        private volatile boolean active = true;

        Lane(ProgressListener listener, Executor sequential) {
            this.listener = listener;
            this.sequential = sequential;
        }

        void offer(SyncEvent event) {
            boolean progress = event instanceof SyncEvent.Progress;
            if (progress && pendingProgress.incrementAndGet() > progressQueueLimit) {
                pendingProgress.decrementAndGet();
                dropped.incrementAndGet();
                return;
            }

            try {
                sequential.execute(() -> deliver(event, progress));
            } catch (RejectedExecutionException e) {
                if (progress)
                    pendingProgress.decrementAndGet();
                LOG.warn("Progress executor rejected {} for {}", event.getClass().getSimpleName(), listener, e);
            }
        }

        private void deliver(SyncEvent event, boolean progress) {
            if (progress)
                pendingProgress.decrementAndGet();
            if (!active)
                return;
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                LOG.warn("Progress listener {} failed on {}", listener, event, e);
            }
        }

        @Override
        public long droppedProgressEvents() {
            return dropped.get();
        }

        @Override
        public void close() {
            active = false;
            lanes.remove(this);
        }
    }
}
