package com.coresidency.core.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable per-host detection record.
 *
 * <p>
 * Created the first time a host is observed and kept for the lifetime of the
 * detector. Holds the bounded sample window, the activity run-lengths used for
 * inclusion gating, the flag/deflag hysteresis counters and the current
 * mitigation state.
 * </p>
 *
 * <h3>Window</h3>
 * <p>
 * The window behaves as a ring buffer: once {@code capacity} samples are held,
 * recording a new sample evicts the oldest one.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. The detector serializes all
 * mutation of host states; use {@link #snapshot()} to hand state to other
 * threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class HostState {

    private final String hostId;
    private final Deque<Map<String, MetricValue>> window = new ArrayDeque<>();
    private int capacity;

    private int consecutiveActive;
    private int consecutiveInactive;
    private boolean included;

    private int flagCount;
    private int deflagCount;
    private boolean mitigating;

    /**
     * @param hostId   host identifier; must not be {@code null}
     * @param capacity window capacity; must be &gt; 0
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public HostState(String hostId, int capacity) {
        this.hostId = Objects.requireNonNull(hostId, "Host ID must not be null");
        this.capacity = requirePositive(capacity);
    }

    // ---------------------------------------------------------------
    // Window
    // ---------------------------------------------------------------

    /**
     * Append a sample, evicting the oldest one on overflow, and update the
     * activity run-lengths from its {@value SampleBatch#ACTIVITY} value.
     *
     * @param sample metric map of one round; must contain
     *               {@value SampleBatch#ACTIVITY}
     */
    public void record(Map<String, MetricValue> sample) {
        Objects.requireNonNull(sample, "Sample must not be null");
        MetricValue activity = Objects.requireNonNull(sample.get(SampleBatch.ACTIVITY),
                "Sample for host " + hostId + " has no " + SampleBatch.ACTIVITY + " metric");

        window.addLast(sample);
        while (window.size() > capacity) {
            window.pollFirst();
        }

        if (activity.isZero()) {
            consecutiveInactive++;
            consecutiveActive = 0;
        } else {
            consecutiveActive++;
            consecutiveInactive = 0;
        }
    }

    /**
     * Change the window capacity. Shrinking trims the oldest samples.
     *
     * @param newCapacity new capacity; must be &gt; 0
     */
    public void resize(int newCapacity) {
        this.capacity = requirePositive(newCapacity);
        while (window.size() > capacity) {
            window.pollFirst();
        }
    }

    /**
     * @return unmodifiable copy of the window, oldest sample first
     */
    public List<Map<String, MetricValue>> window() {
        return Collections.unmodifiableList(new ArrayList<>(window));
    }

    /**
     * @return the most recent sample, or an empty map if none was recorded
     */
    public Map<String, MetricValue> latest() {
        Map<String, MetricValue> last = window.peekLast();
        return last != null ? last : Map.of();
    }

    public int windowSize() {
        return window.size();
    }

    public int capacity() {
        return capacity;
    }

    // ---------------------------------------------------------------
    // Inclusion
    // ---------------------------------------------------------------

    public int consecutiveActive() {
        return consecutiveActive;
    }

    public int consecutiveInactive() {
        return consecutiveInactive;
    }

    public boolean isIncluded() {
        return included;
    }

    public void include() {
        this.included = true;
    }

    public void exclude() {
        this.included = false;
    }

    // ---------------------------------------------------------------
    // Hysteresis
    // ---------------------------------------------------------------

    public int flagCount() {
        return flagCount;
    }

    public int deflagCount() {
        return deflagCount;
    }

    public boolean isMitigating() {
        return mitigating;
    }

    /**
     * Record one over-threshold round while not mitigating.
     *
     * @return the new flag count
     */
    public int flag() {
        deflagCount = 0;
        return ++flagCount;
    }

    /**
     * Record one non-triggering round while mitigating.
     *
     * @return the new deflag count
     */
    public int deflag() {
        return ++deflagCount;
    }

    public void resetDeflags() {
        deflagCount = 0;
    }

    public void startMitigating() {
        mitigating = true;
        resetCounters();
    }

    public void stopMitigating() {
        mitigating = false;
        resetCounters();
    }

    private void resetCounters() {
        flagCount = 0;
        deflagCount = 0;
    }

    // ---------------------------------------------------------------
    // Snapshot
    // ---------------------------------------------------------------

    public String hostId() {
        return hostId;
    }

    /**
     * @return immutable copy of the current state
     */
    public HostSnapshot snapshot() {
        return new HostSnapshot(hostId, window.size(), capacity, consecutiveActive,
                consecutiveInactive, included, flagCount, deflagCount, mitigating);
    }

    private static int requirePositive(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Window capacity must be > 0, got: " + capacity);
        }
        return capacity;
    }

    @Override
    public String toString() {
        return "HostState{" +
                "hostId='" + hostId + '\'' +
                ", window=" + window.size() + "/" + capacity +
                ", included=" + included +
                ", flags=" + flagCount +
                ", deflags=" + deflagCount +
                ", mitigating=" + mitigating +
                '}';
    }
}
