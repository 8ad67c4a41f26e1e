/**
 * Reference service around the co-residency detector.
 *
 * <p>
 * Reads sample batches as JSON lines, runs them through a
 * {@link com.coresidency.core.detection.CoResidencyDetector} and writes every
 * mitigation decision as a JSON line, while the configuration file is watched
 * for changes.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.coresidency.service.CoResidencyService} : main entry
 * point</li>
 * <li>{@link com.coresidency.service.ServiceConfig} : environment-driven
 * configuration</li>
 * <li>{@link com.coresidency.service.HealthServer} : HTTP health, readiness
 * and status endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.coresidency.service;
