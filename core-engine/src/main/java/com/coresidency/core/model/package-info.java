/**
 * Domain model of the co-residency detector.
 *
 * <ul>
 * <li>{@link com.coresidency.core.model.MetricValue}: numeric capability of a
 * metric, with {@link com.coresidency.core.model.DoubleMetric} as the
 * floating-point implementation</li>
 * <li>{@link com.coresidency.core.model.SampleBatch}: one validated round of
 * per-host samples</li>
 * <li>{@link com.coresidency.core.model.HostState}: per-host window, run-lengths
 * and hysteresis counters</li>
 * <li>{@link com.coresidency.core.model.MitigationDecision}: a start/stop
 * transition</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.coresidency.core.model;
