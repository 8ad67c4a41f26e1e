package com.coresidency.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process {@link EventBus} that invokes handlers on the emitting thread.
 *
 * <p>
 * Handlers run in subscription order. An exception thrown by a handler
 * propagates to the caller of {@link #emit(String, Object)} and stops delivery
 * to the remaining handlers of that event, so rejected input surfaces where it
 * was published.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Subscribing, cancelling and emitting may happen concurrently from any
 * thread. The bus itself does not serialize handler invocations; handlers that
 * can be reached from several threads must be thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class SynchronousEventBus implements EventBus {

    private static final Logger LOG = LoggerFactory.getLogger(SynchronousEventBus.class);

    private final Map<String, List<Consumer<Object>>> handlers = new ConcurrentHashMap<>();

    @Override
    public void emit(String name, Object payload) {
        Objects.requireNonNull(name, "Event name must not be null");
        List<Consumer<Object>> registered = handlers.get(name);
        if (registered == null || registered.isEmpty()) {
            LOG.trace("No subscribers for event {}", name);
            return;
        }
        LOG.debug("Emitting event {} to {} subscriber(s)", name, registered.size());
        for (Consumer<Object> handler : registered) {
            handler.accept(payload);
        }
    }

    @Override
    public <T> Subscription subscribe(String name, Class<T> payloadType, Consumer<? super T> handler) {
        Objects.requireNonNull(name, "Event name must not be null");
        Objects.requireNonNull(payloadType, "Payload type must not be null");
        Objects.requireNonNull(handler, "Handler must not be null");

        Consumer<Object> typed = payload -> handler.accept(payloadType.cast(payload));
        handlers.computeIfAbsent(name, k -> new CopyOnWriteArrayList<>()).add(typed);
        LOG.debug("Registered {} handler for event {}", payloadType.getSimpleName(), name);

        return () -> {
            List<Consumer<Object>> registered = handlers.get(name);
            if (registered != null && registered.remove(typed)) {
                LOG.debug("Cancelled {} handler for event {}", payloadType.getSimpleName(), name);
            }
        };
    }

    /**
     * @param name wire name of the event
     * @return number of handlers currently subscribed under {@code name}
     */
    public int subscriberCount(String name) {
        List<Consumer<Object>> registered = handlers.get(name);
        return registered != null ? registered.size() : 0;
    }
}
