package com.coresidency.core.event;

import java.util.function.Consumer;

/**
 * Publish/subscribe transport between the detector and its collaborators.
 *
 * <p>
 * Event names are plain strings taken from the configuration's
 * {@code EventNames} section. One {@link #emit(String, Object)} call delivers
 * exactly one invocation to every handler subscribed under that name; events
 * are never buffered or coalesced.
 * </p>
 *
 * @since 1.0.0
 */
public interface EventBus {

    /**
     * Publish an event.
     *
     * @param name    wire name of the event
     * @param payload event payload
     */
    void emit(String name, Object payload);

    /**
     * Register a handler for events published under {@code name}.
     *
     * @param name        wire name of the event
     * @param payloadType expected payload type; payloads of another type are
     *                    rejected with {@link ClassCastException}
     * @param handler     callback invoked once per event
     * @param <T>         payload type
     * @return handle that removes the registration when cancelled
     */
    <T> Subscription subscribe(String name, Class<T> payloadType, Consumer<? super T> handler);

    /**
     * Registration handle returned by {@link #subscribe}.
     */
    @FunctionalInterface
    interface Subscription {

        /** Remove the handler. Idempotent. */
        void cancel();
    }
}
