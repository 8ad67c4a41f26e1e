/**
 * Detector configuration: the immutable
 * {@link com.coresidency.core.config.DetectorConfiguration} snapshot, its
 * file parser and the hot-reloading
 * {@link com.coresidency.core.config.ConfigurationManager}.
 *
 * <p>
 * Parsing validates everything up front so that an invalid file is rejected
 * as a whole and never reaches the detector.
 * </p>
 *
 * @since 1.0.0
 */
package com.coresidency.core.config;
