package org.profd.session;

/**
 * The lifecycle state of the session controller.
 */
public enum SessionState {
    /**
     * No session is running. A new session may be started.
     */
    IDLE,
    /**
     * A session execution is in flight. It stays in this state after a stop request until the
     * execution thread itself finishes.
     */
    RUNNING
}
