package com.switchboard.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for operation lifecycle events.
 * <p>
 * Subscribers follow one operation or every operation, optionally narrowed to
 * a set of {@link OperationEventType}s. Events of one operation reach a
 * subscriber in publish order. A subscriber that throws is logged and never
 * affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Subscriber>> operationSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Subscriber> globalSubscribers = new CopyOnWriteArrayList<>();

    public void publish(SwitchboardEvent event) {
        log.debug("Publishing event: {} for operation {}", event.eventType(), event.operationId());

        List<Subscriber> subs = operationSubscribers.get(event.operationId());
        if (subs != null) {
            for (Subscriber subscriber : subs) {
                subscriber.deliver(event);
            }
        }
        for (Subscriber subscriber : globalSubscribers) {
            subscriber.deliver(event);
        }
    }

    public Subscription subscribe(String operationId, Consumer<SwitchboardEvent> consumer) {
        return subscribe(operationId, EnumSet.allOf(OperationEventType.class), consumer);
    }

    public Subscription subscribe(String operationId, Set<OperationEventType> types,
                                  Consumer<SwitchboardEvent> consumer) {
        Subscriber subscriber = Subscriber.of(types, consumer);
        operationSubscribers.computeIfAbsent(operationId, k -> new CopyOnWriteArrayList<>()).add(subscriber);
        return () -> operationSubscribers.computeIfPresent(operationId, (id, subs) -> {
            subs.remove(subscriber);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<SwitchboardEvent> consumer) {
        return subscribeAll(EnumSet.allOf(OperationEventType.class), consumer);
    }

    public Subscription subscribeAll(Set<OperationEventType> types, Consumer<SwitchboardEvent> consumer) {
        Subscriber subscriber = Subscriber.of(types, consumer);
        globalSubscribers.add(subscriber);
        return () -> globalSubscribers.remove(subscriber);
    }

    /** Number of subscribers following this operation. */
    public int subscriberCount(String operationId) {
        List<Subscriber> subs = operationSubscribers.get(operationId);
        return subs == null ? 0 : subs.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private record Subscriber(Set<OperationEventType> types, Consumer<SwitchboardEvent> consumer) {

        static Subscriber of(Set<OperationEventType> types, Consumer<SwitchboardEvent> consumer) {
            if (types == null || types.isEmpty()) {
                throw new IllegalArgumentException("Subscription needs at least one event type");
            }
            return new Subscriber(EnumSet.copyOf(types), consumer);
        }

        void deliver(SwitchboardEvent event) {
            if (!types.contains(event.type())) {
                return;
            }
            try {
                consumer.accept(event);
            } catch (Exception e) {
                log.warn("Subscriber threw exception processing event {}: {}",
                        event.eventType(), e.getMessage(), e);
            }
        }
    }
}
