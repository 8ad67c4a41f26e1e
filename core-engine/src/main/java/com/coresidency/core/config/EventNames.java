package com.coresidency.core.config;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable mapping from {@link EventType} to wire name.
 *
 * <p>
 * Event types absent from the source map keep their default wire name.
 * </p>
 *
 * @since 1.0.0
 */
public final class EventNames {

    private static final EventNames DEFAULTS = new EventNames(Map.of());

    private final Map<EventType, String> names;

    private EventNames(Map<EventType, String> overrides) {
        EnumMap<EventType, String> resolved = new EnumMap<>(EventType.class);
        for (EventType type : EventType.values()) {
            String name = overrides.get(type);
            resolved.put(type, name != null ? name : type.defaultWireName());
        }
        this.names = Collections.unmodifiableMap(resolved);
    }

    public static EventNames defaults() {
        return DEFAULTS;
    }

    /**
     * @param overrides wire names to use instead of the defaults; values must
     *                  not be blank
     * @return resolved event names
     * @throws IllegalArgumentException if an override is blank
     */
    public static EventNames of(Map<EventType, String> overrides) {
        Objects.requireNonNull(overrides, "Event name overrides must not be null");
        overrides.forEach((type, name) -> {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException(
                        "Wire name for " + type.logicalName() + " must not be null or blank");
            }
        });
        return new EventNames(overrides);
    }

    /**
     * @param type logical event
     * @return the wire name used on the event bus
     */
    public String wireName(EventType type) {
        return names.get(type);
    }

    public Map<EventType, String> asMap() {
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EventNames that))
            return false;
        return names.equals(that.names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return "EventNames" + names;
    }
}
