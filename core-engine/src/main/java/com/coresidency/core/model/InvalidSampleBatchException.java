package com.coresidency.core.model;

/**
 * Raised when a sample batch is structurally unusable: a missing or non-binary
 * {@code Activity} metric, heterogeneous metric key sets across hosts, blank
 * host IDs, or values that are not numeric-like.
 *
 * <p>
 * Batches are rejected as a whole before any host state is touched.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidSampleBatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidSampleBatchException(String message) {
        super(message);
    }

    public InvalidSampleBatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
