package org.profd.api.engine;

/**
 * Final result of one sampling engine run.
 */
public enum EngineOutcome {
    /**
     * All requested iterations were performed.
     */
    SUCCESS,
    /**
     * The engine hit a fatal condition and ended the loop early.
     */
    FAILURE,
    /**
     * The run was cut short by a stop request or thread interruption.
     */
    INTERRUPTED
}
