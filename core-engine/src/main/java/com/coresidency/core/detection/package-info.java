/**
 * Detection engine.
 *
 * <ul>
 * <li>{@link com.coresidency.core.detection.StatisticsEngine}: population
 * averages, optionally normalized over each host's window</li>
 * <li>{@link com.coresidency.core.detection.DeviationEvaluator}: per-metric
 * deviation against thresholds, OR across metrics</li>
 * <li>{@link com.coresidency.core.detection.HysteresisEngine}: inclusion and
 * flag/deflag state machine</li>
 * <li>{@link com.coresidency.core.detection.CoResidencyDetector}: batch
 * orchestration, event emission and configuration swapping</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.coresidency.core.detection;
