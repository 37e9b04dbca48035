package org.codenode.fbp.api.runtime;

import java.time.Instant;

/**
 * Structured information about a failure inside a node runtime.
 *
 * @param timestamp When the error occurred.
 * @param errorType A category for the error (e.g. {@code "PROCESSING_FAILED"}).
 * @param message   A human-readable description.
 * @param details   Additional context such as the node id and the exception type.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
