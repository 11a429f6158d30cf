package de.bsommerfeld.gamesync.core.event;

import com.google.common.eventbus.EventBus;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus} that decouples event
 * producers (sync sessions, the launcher) from observers (console output,
 * log files, a future UI).
 *
 * <p>
 * Delivery is synchronous on the posting thread. Producers that must never
 * block on observers (the download orchestrator) publish through the
 * progress channel, which hands events to this bus from its own lanes.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus("GameSync-EventBus");
    }

    public void post(Object event) {
        // Byte-level progress is far too chatty for debug output
        if (!event.getClass().getSimpleName().equals("Progress")) {
            LOG.debug("Posting event: {}", event);
        }
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }
}
