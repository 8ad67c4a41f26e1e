package com.coresidency.core.model;

/**
 * Direction of a mitigation transition.
 *
 * @since 1.0.0
 */
public enum MitigationAction {
    START,
    STOP
}
