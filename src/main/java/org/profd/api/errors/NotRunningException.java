package org.profd.api.errors;

/**
 * Thrown when a stop is requested while no session is running.
 */
public class NotRunningException extends IllegalStateException {

    public NotRunningException(String message) {
        super(message);
    }
}
