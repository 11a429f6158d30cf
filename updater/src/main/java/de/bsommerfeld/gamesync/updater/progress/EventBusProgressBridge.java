package de.bsommerfeld.gamesync.updater.progress;

import de.bsommerfeld.gamesync.core.event.ApplicationEventBus;

/**
 * Republishes session events on the application event bus, so observers can
 * receive them through {@code @Subscribe} methods.
 */
public final class EventBusProgressBridge implements ProgressListener {

    private final ApplicationEventBus eventBus;

    public EventBusProgressBridge(ApplicationEventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void onEvent(SyncEvent event) {
        eventBus.post(event);
    }

    /** Subscribes a new bridge to the channel. */
    public static Subscription connect(ProgressChannel channel, ApplicationEventBus eventBus) {
        return channel.subscribe(new EventBusProgressBridge(eventBus));
    }
}
