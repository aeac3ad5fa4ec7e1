package com.waypoint.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for mission events.
 * <p>
 * Supports per-mission subscriptions and global subscriptions. A subscriber that throws
 * is logged and does not affect delivery to the others.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<MissionEvent>>> missionSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<MissionEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(MissionEvent event) {
        log.debug("Publishing event: {} for mission {}", event.eventType(), event.missionId());

        List<Consumer<MissionEvent>> missionSubs = missionSubscribers.get(event.missionId());
        if (missionSubs != null) {
            for (Consumer<MissionEvent> subscriber : missionSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<MissionEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public Subscription subscribe(String missionId, Consumer<MissionEvent> consumer) {
        missionSubscribers.computeIfAbsent(missionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to mission {}", missionId);
        return () -> {
            CopyOnWriteArrayList<Consumer<MissionEvent>> subs = missionSubscribers.get(missionId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    missionSubscribers.remove(missionId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<MissionEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<MissionEvent> subscriber, MissionEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
