package de.bsommerfeld.gamesync.updater.progress;

import com.google.common.eventbus.Subscribe;
import com.google.common.util.concurrent.MoreExecutors;
import de.bsommerfeld.gamesync.core.event.ApplicationEventBus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class EventBusProgressBridgeTest {

    @Mock
    private ApplicationEventBus mockBus;

    @Test
    void onEvent_shouldPostToEventBus() {
        SyncEvent event = new SyncEvent.FileDeleted("s", "old.jar");

        new EventBusProgressBridge(mockBus).onEvent(event);

        verify(mockBus).post(event);
    }

    @Test
    void connect_shouldReachTypedSubscribers() {
        ApplicationEventBus bus = new ApplicationEventBus();
        ProgressChannel channel = new ProgressChannel(MoreExecutors.directExecutor(), 8);
        List<SyncEvent.FileFailed> failures = new ArrayList<>();
        bus.register(new Object() {
            @Subscribe
            public void onFailure(SyncEvent.FileFailed event) {
                failures.add(event);
            }
        });

        EventBusProgressBridge.connect(channel, bus);
        channel.publish(new SyncEvent.FileDeleted("s", "a"));
        channel.publish(new SyncEvent.FileFailed("s", "b", "HTTP 404"));

        assertEquals(List.of(new SyncEvent.FileFailed("s", "b", "HTTP 404")), failures);
    }
}
