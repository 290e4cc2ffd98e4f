package org.profd.api.queue;

/**
 * Thrown when the telemetry queue refuses or fails to accept an entry.
 */
public class TelemetryQueueException extends Exception {

    public TelemetryQueueException(String message) {
        super(message);
    }

    public TelemetryQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
