package com.sportsdata.application.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous topic based publish/subscribe channel.
 *
 * <p>Delivery happens on the publishing thread, at most once, to the listeners registered
 * when {@link #publish} is called. A listener that throws is logged and skipped.
 *
 * @param <E> event type carried by this bus
 */
public class EventBus<E> {

    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    private final String name;
    private final Map<String, List<Consumer<? super E>>> listeners = new ConcurrentHashMap<>();

    public EventBus(String name) {
        this.name = name;
    }

    public Subscription subscribe(String topic, Consumer<? super E> listener) {
        if (topic == null || listener == null) {
            throw new IllegalArgumentException("topic and listener are required");
        }
        listeners.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(listener);
        logger.debug("[{}] listener subscribed to {}", name, topic);

        return new Subscription() {
            @Override
            public String topic() {
                return topic;
            }

            @Override
            public boolean cancel() {
                return unsubscribe(topic, listener);
            }
        };
    }

    public boolean unsubscribe(String topic, Consumer<? super E> listener) {
        List<Consumer<? super E>> registered = listeners.get(topic);
        return registered != null && registered.remove(listener);
    }

    /**
     * @return number of listeners that received the event without throwing
     */
    public int publish(String topic, E event) {
        List<Consumer<? super E>> registered = listeners.get(topic);
        if (registered == null || registered.isEmpty()) {
            return 0;
        }

        int delivered = 0;
        for (Consumer<? super E> listener : registered) {
            try {
                listener.accept(event);
                delivered++;
            } catch (RuntimeException e) {
                logger.warn("[{}] listener for {} failed: {}", name, topic, e.getMessage(), e);
            }
        }
        return delivered;
    }

    public int subscriberCount(String topic) {
        List<Consumer<? super E>> registered = listeners.get(topic);
        return registered == null ? 0 : registered.size();
    }
}
