package org.profd.api.errors;

/**
 * Thrown when an artifact cannot be serialized for delivery.
 */
public class SerializationException extends Exception {

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
