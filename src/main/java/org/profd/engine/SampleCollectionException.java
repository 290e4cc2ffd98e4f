package org.profd.engine;

/**
 * Thrown when a sampling round fails.
 */
public class SampleCollectionException extends Exception {

    private final boolean fatal;

    /**
     * @param message Description of the failure.
     * @param fatal   Whether the session cannot continue after this failure.
     */
    public SampleCollectionException(String message, boolean fatal) {
        super(message);
        this.fatal = fatal;
    }

    public SampleCollectionException(String message, boolean fatal, Throwable cause) {
        super(message, cause);
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
