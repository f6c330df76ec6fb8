package com.automate.ScanOps.Service;

import com.automate.ScanOps.Config.StreamProperties;
import com.automate.ScanOps.Models.StatusEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class StatusStreamServiceTest {

    private TaskScheduler scheduler;
    private StatusStreamService streams;
    private final String key = StatusStreamService.runKey(UUID.randomUUID());

    @BeforeEach
    void setUp() {
        StreamProperties props = new StreamProperties();
        props.setReplayBufferSize(3);
        scheduler = mock(TaskScheduler.class);
        streams = new StatusStreamService(props, scheduler);
    }

    private static class Recorder implements StatusStreamService.StatusSubscriber {
        final List<StatusEvent> events = new ArrayList<>();
        int completions;

        @Override
        public void onEvent(StatusEvent event) {
            events.add(event);
        }

        @Override
        public void onComplete() {
            completions++;
        }
    }

    @Test
    void liveSubscriberSeesEventsInPublishOrder() {
        Recorder r = new Recorder();
        streams.subscribe(key, r);

        streams.publish(key, StatusEvent.init("RUNNING", "10.0.0.1"));
        streams.publish(key, StatusEvent.outputChunk("stdout", "a"));
        streams.publish(key, StatusEvent.outputChunk("stdout", "b"));

        assertEquals(List.of(StatusEvent.Type.INIT, StatusEvent.Type.OUTPUT_CHUNK, StatusEvent.Type.OUTPUT_CHUNK),
                r.events.stream().map(StatusEvent::type).toList());
        assertEquals("b", r.events.get(2).data().get("chunk"));
    }

    @Test
    void lateSubscriberGetsReplayThenLive() {
        streams.publish(key, StatusEvent.init("RUNNING", "t"));
        streams.publish(key, StatusEvent.outputChunk("stdout", "first"));

        Recorder late = new Recorder();
        streams.subscribe(key, late);
        streams.publish(key, StatusEvent.outputChunk("stdout", "second"));

        assertEquals(3, late.events.size());
        assertEquals(StatusEvent.Type.INIT, late.events.get(0).type());
        assertEquals("second", late.events.get(2).data().get("chunk"));
    }

    @Test
    void replayBufferKeepsOnlyTheNewestEvents() {
        for (int i = 0; i < 5; i++) {
            streams.publish(key, StatusEvent.outputChunk("stdout", "c" + i));
        }
        Recorder r = new Recorder();
        streams.subscribe(key, r);

        assertEquals(List.of("c2", "c3", "c4"), r.events.stream().map(e -> e.data().get("chunk")).toList());
    }

    @Test
    void acceptsOneTerminalEventOnly() {
        Recorder r = new Recorder();
        streams.subscribe(key, r);

        assertTrue(streams.publish(key, StatusEvent.completed("COMPLETED", 0, 3L)));
        assertFalse(streams.publish(key, StatusEvent.failed("FAILED", "late")));
        assertFalse(streams.publish(key, StatusEvent.outputChunk("stdout", "late")));

        assertEquals(1, r.events.size());
        assertEquals(1, r.completions);
        assertTrue(streams.isTerminated(key));
        assertEquals(0, streams.subscriberCount(key));
    }

    @Test
    void subscriberAfterTerminalGetsReplayAndCompletes() {
        streams.publish(key, StatusEvent.init("RUNNING", "t"));
        streams.publish(key, StatusEvent.failed("FAILED", "boom"));

        Recorder r = new Recorder();
        streams.subscribe(key, r);

        assertEquals(2, r.events.size());
        assertTrue(r.events.get(1).isTerminal());
        assertEquals(1, r.completions);
        assertEquals(0, streams.subscriberCount(key));
    }

    @Test
    void throwingSubscriberIsDroppedOthersKeepReceiving() {
        Recorder healthy = new Recorder();
        streams.subscribe(key, new StatusStreamService.StatusSubscriber() {
            @Override
            public void onEvent(StatusEvent event) throws IOException {
                throw new IOException("Broken pipe");
            }

            @Override
            public void onComplete() {
            }
        });
        streams.subscribe(key, healthy);

        streams.publish(key, StatusEvent.progress(10, "AUTOMATED_SCAN"));
        streams.publish(key, StatusEvent.progress(20, "AUTOMATED_SCAN"));

        assertEquals(2, healthy.events.size());
        assertEquals(1, streams.subscriberCount(key));
    }

    @Test
    void unsubscribeStopsDelivery() {
        Recorder r = new Recorder();
        Runnable detach = streams.subscribe(key, r);
        streams.publish(key, StatusEvent.progress(1, null));
        detach.run();
        streams.publish(key, StatusEvent.progress(2, null));

        assertEquals(1, r.events.size());
    }

    @Test
    void terminalChannelIsDisposedByScheduledCleanup() {
        streams.publish(key, StatusEvent.completed("COMPLETED", 0, 1L));

        ArgumentCaptor<Runnable> cleanup = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(cleanup.capture(), any(Instant.class));
        assertTrue(streams.hasChannel(key));

        cleanup.getValue().run();
        assertFalse(streams.hasChannel(key));
    }

    @Test
    void closeCompletesAttachedSubscribers() {
        Recorder r = new Recorder();
        streams.subscribe(key, r);
        streams.close(key);

        assertEquals(1, r.completions);
        assertFalse(streams.hasChannel(key));
    }
}
