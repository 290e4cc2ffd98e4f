package org.profd.api.errors;

/**
 * Thrown when a structured configuration blob cannot be decoded.
 */
public class ConfigDecodeException extends Exception {

    public ConfigDecodeException(String message) {
        super(message);
    }

    public ConfigDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
