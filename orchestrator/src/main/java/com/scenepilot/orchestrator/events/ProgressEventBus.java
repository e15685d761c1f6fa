package com.scenepilot.orchestrator.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * In-memory publish/subscribe bus for progress events.
 * <p>
 * A topic is a project id or a task id; an event is delivered to the
 * subscribers of both, plus to global subscribers. Delivery is synchronous on
 * the publishing thread, so the events of one task reach a subscriber in the
 * order they were published. Nothing is buffered: a subscriber only sees
 * events published while it is subscribed, and there is no replay.
 */
@Service
public class ProgressEventBus {

    private static final Logger log = LoggerFactory.getLogger(ProgressEventBus.class);

    private final ConcurrentHashMap<UUID, CopyOnWriteArrayList<Registration>> topicSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Registration> globalSubscribers = new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers.
     */
    public void publish(ProgressEvent event) {
        log.debug("Publishing {} for project {} task {}", event.type(), event.projectId(), event.taskId());

        deliverAll(topicSubscribers.get(event.projectId()), event);
        if (event.taskId() != null) {
            deliverAll(topicSubscribers.get(event.taskId()), event);
        }
        deliverAll(globalSubscribers, event);
    }

    /**
     * Subscribe to the events of one project or one task.
     *
     * @param topic   a project id or a task id
     * @param consumer callback invoked for each event
     * @return a handle that stops delivery immediately when cancelled
     */
    public Subscription subscribe(UUID topic, Consumer<ProgressEvent> consumer) {
        Registration reg = new Registration(consumer);
        topicSubscribers.computeIfAbsent(topic, k -> new CopyOnWriteArrayList<>()).add(reg);
        log.debug("Subscribed to topic {}", topic);
        return () -> {
            reg.active.set(false);
            topicSubscribers.computeIfPresent(topic, (k, subs) -> {
                subs.remove(reg);
                return subs.isEmpty() ? null : subs;
            });
        };
    }

    /**
     * Subscribe to every event on the bus.
     */
    public Subscription subscribeAll(Consumer<ProgressEvent> consumer) {
        Registration reg = new Registration(consumer);
        globalSubscribers.add(reg);
        log.debug("Subscribed to all events (global)");
        return () -> {
            reg.active.set(false);
            globalSubscribers.remove(reg);
        };
    }

    /** Number of topic subscriptions currently registered. */
    public int subscriberCount(UUID topic) {
        List<Registration> subs = topicSubscribers.get(topic);
        return subs == null ? 0 : subs.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverAll(List<Registration> subscribers, ProgressEvent event) {
        if (subscribers == null) return;
        for (Registration reg : subscribers) {
            // A subscriber cancelled during this loop must not get the event.
            if (reg.active.get()) {
                deliverSafely(reg.consumer, event);
            }
        }
    }

    private void deliverSafely(Consumer<ProgressEvent> subscriber, ProgressEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.type(), e.getMessage(), e);
        }
    }

    private static final class Registration {
        final Consumer<ProgressEvent> consumer;
        final AtomicBoolean active = new AtomicBoolean(true);

        Registration(Consumer<ProgressEvent> consumer) {
            this.consumer = consumer;
        }
    }
}
