package org.profd.api.errors;

/**
 * Thrown when a session is started while another one is still running.
 */
public class AlreadyRunningException extends IllegalStateException {

    public AlreadyRunningException(String message) {
        super(message);
    }
}
