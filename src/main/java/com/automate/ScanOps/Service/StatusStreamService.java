package com.automate.ScanOps.Service;

import com.automate.ScanOps.Config.StreamProperties;
import com.automate.ScanOps.Models.StatusEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process fan-out of {@link StatusEvent}s keyed by run or session.
 * <p>
 * Every channel keeps a bounded replay buffer so a late subscriber first receives what it
 * missed, then live events, in publish order. A channel accepts exactly one terminal event;
 * anything published after it is dropped. Finished channels are removed after a grace period.
 * No authorization happens here, callers check access before subscribing.
 */
@Slf4j
@Service
public class StatusStreamService {

    /** Receiver side of a channel; a throwing subscriber is dropped. */
    public interface StatusSubscriber {
        void onEvent(StatusEvent event) throws Exception;

        void onComplete();
    }

    private final Map<String, Channel> channels = new ConcurrentHashMap<>();
    private final StreamProperties props;
    private final TaskScheduler scheduler;

    public StatusStreamService(StreamProperties props, @Qualifier("streamScheduler") TaskScheduler scheduler) {
        this.props = props;
        this.scheduler = scheduler;
    }

    public static String runKey(UUID runId) {
        return "run:" + runId;
    }

    public static String scanKey(UUID sessionId) {
        return "scan:" + sessionId;
    }

    /** @return false when the event was dropped because the channel already terminated */
    public boolean publish(String key, StatusEvent event) {
        Channel channel = channels.computeIfAbsent(key, k -> new Channel(props.getReplayBufferSize()));
        boolean accepted;
        synchronized (channel) {
            accepted = channel.publish(key, event);
        }
        if (accepted && event.isTerminal()) {
            scheduleCleanup(key, channel);
        }
        return accepted;
    }

    /**
     * Replays the buffer to {@code subscriber} and registers it for live events.
     * If the channel already terminated the subscriber is completed right after the replay.
     *
     * @return handle that detaches the subscriber
     */
    public Runnable subscribe(String key, StatusSubscriber subscriber) {
        Channel channel = channels.computeIfAbsent(key, k -> new Channel(props.getReplayBufferSize()));
        synchronized (channel) {
            channel.attach(key, subscriber);
        }
        return () -> unsubscribe(key, channel, subscriber);
    }

    public boolean hasChannel(String key) {
        return channels.containsKey(key);
    }

    public boolean isTerminated(String key) {
        Channel channel = channels.get(key);
        if (channel == null) {
            return false;
        }
        synchronized (channel) {
            return channel.terminated;
        }
    }

    public int subscriberCount(String key) {
        Channel channel = channels.get(key);
        if (channel == null) {
            return 0;
        }
        synchronized (channel) {
            return channel.subscribers.size();
        }
    }

    /** Drops a channel right away, completing anyone still attached. */
    public void close(String key) {
        Channel channel = channels.remove(key);
        if (channel == null) {
            return;
        }
        synchronized (channel) {
            channel.completeAll();
        }
    }

    private void unsubscribe(String key, Channel channel, StatusSubscriber subscriber) {
        synchronized (channel) {
            channel.subscribers.remove(subscriber);
        }
        log.debug("Subscriber detached from {}", key);
    }

    private void scheduleCleanup(String key, Channel channel) {
        scheduler.schedule(() -> {
            if (channels.remove(key, channel)) {
                log.debug("Stream channel {} disposed", key);
            }
        }, Instant.now().plus(props.getCleanupDelay()));
    }

    private static final class Channel {
        private final int capacity;
        private final Deque<StatusEvent> replay = new ArrayDeque<>();
        private final List<StatusSubscriber> subscribers = new ArrayList<>();
        private boolean terminated;

        private Channel(int capacity) {
            this.capacity = capacity;
        }

        private boolean publish(String key, StatusEvent event) {
            if (terminated) {
                log.debug("Dropping {} on {}: channel already terminated", event.type().wireName(), key);
                return false;
            }
            replay.addLast(event);
            while (replay.size() > capacity) {
                replay.removeFirst();
            }

            List<StatusSubscriber> dead = new ArrayList<>();
            for (StatusSubscriber s : subscribers) {
                if (!deliver(key, s, event)) {
                    dead.add(s);
                }
            }
            subscribers.removeAll(dead);

            if (event.isTerminal()) {
                terminated = true;
                completeAll();
            }
            return true;
        }

        private void attach(String key, StatusSubscriber subscriber) {
            for (StatusEvent event : replay) {
                if (!deliver(key, subscriber, event)) {
                    return;
                }
            }
            if (terminated) {
                subscriber.onComplete();
            } else {
                subscribers.add(subscriber);
            }
        }

        private void completeAll() {
            for (StatusSubscriber s : subscribers) {
                s.onComplete();
            }
            subscribers.clear();
        }

        private static boolean deliver(String key, StatusSubscriber subscriber, StatusEvent event) {
            try {
                subscriber.onEvent(event);
                return true;
            } catch (Exception e) {
                log.warn("Stream subscriber on {} is dead, dropping it: {}", key, e.toString());
                return false;
            }
        }
    }
}
