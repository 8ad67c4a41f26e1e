package com.coresidency.core.model;

import java.util.Objects;

/**
 * Immutable point-in-time view of a {@link HostState}, safe to share across
 * threads.
 *
 * @since 1.0.0
 */
public final class HostSnapshot {

    private final String hostId;
    private final int windowSize;
    private final int capacity;
    private final int consecutiveActive;
    private final int consecutiveInactive;
    private final boolean included;
    private final int flagCount;
    private final int deflagCount;
    private final boolean mitigating;

    HostSnapshot(String hostId, int windowSize, int capacity, int consecutiveActive,
            int consecutiveInactive, boolean included, int flagCount, int deflagCount,
            boolean mitigating) {
        this.hostId = hostId;
        this.windowSize = windowSize;
        this.capacity = capacity;
        this.consecutiveActive = consecutiveActive;
        this.consecutiveInactive = consecutiveInactive;
        this.included = included;
        this.flagCount = flagCount;
        this.deflagCount = deflagCount;
        this.mitigating = mitigating;
    }

    public String getHostId() {
        return hostId;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getConsecutiveActive() {
        return consecutiveActive;
    }

    public int getConsecutiveInactive() {
        return consecutiveInactive;
    }

    public boolean isIncluded() {
        return included;
    }

    public int getFlagCount() {
        return flagCount;
    }

    public int getDeflagCount() {
        return deflagCount;
    }

    public boolean isMitigating() {
        return mitigating;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof HostSnapshot that))
            return false;
        return windowSize == that.windowSize
                && capacity == that.capacity
                && consecutiveActive == that.consecutiveActive
                && consecutiveInactive == that.consecutiveInactive
                && included == that.included
                && flagCount == that.flagCount
                && deflagCount == that.deflagCount
                && mitigating == that.mitigating
                && hostId.equals(that.hostId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hostId, windowSize, capacity, consecutiveActive, consecutiveInactive,
                included, flagCount, deflagCount, mitigating);
    }

    @Override
    public String toString() {
        return "HostSnapshot{" +
                "hostId='" + hostId + '\'' +
                ", window=" + windowSize + "/" + capacity +
                ", active=" + consecutiveActive +
                ", inactive=" + consecutiveInactive +
                ", included=" + included +
                ", flags=" + flagCount +
                ", deflags=" + deflagCount +
                ", mitigating=" + mitigating +
                '}';
    }
}
