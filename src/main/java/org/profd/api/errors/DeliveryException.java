package org.profd.api.errors;

/**
 * Thrown when a serialized artifact could not be handed to its destination.
 */
public class DeliveryException extends Exception {

    /**
     * The delivery step that failed.
     */
    public enum Kind {
        /** The telemetry queue failed the in-memory submission. */
        INLINE_SUBMIT,
        /** The private temporary file could not be created, written or reopened. */
        TEMP_FILE,
        /** The telemetry queue rejected the file submission. */
        QUEUE_REJECT,
        /** The artifact could not be written to local storage. */
        LOCAL_WRITE
    }

    private final Kind kind;

    public DeliveryException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DeliveryException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
