package org.profd.api.monitoring;

import java.time.Instant;

/**
 * Represents a transient error that occurred while a session was running.
 * <p>
 * Such errors do not stop the session. They are kept for the diagnostic surfaces only.
 *
 * @param timestamp The timestamp of when the error occurred.
 * @param errorType A category for the error (e.g., "SERIALIZATION_FAILED", "TEMP_FILE").
 * @param message   A human-readable description of the error.
 * @param details   Optional additional context.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
