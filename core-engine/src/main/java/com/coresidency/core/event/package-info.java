/**
 * Event bus contract and the in-process synchronous implementation used to
 * connect the detector, the configuration manager and the caller.
 *
 * @since 1.0.0
 */
package com.coresidency.core.event;
