package org.profd.api.monitoring;

import java.util.List;
import java.util.Map;

/**
 * An interface for components that can be monitored.
 */
public interface IMonitorable {

    /**
     * Returns a map of metrics for the component, keyed by metric name
     * (e.g., "artifacts_delivered").
     *
     * @return A map of metric names to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * Returns the operational errors recorded since the last {@link #clearErrors()}.
     *
     * @return A list of {@link OperationalError}s, oldest first.
     */
    List<OperationalError> getErrors();

    /**
     * Clears the list of operational errors. This is an administrative action.
     */
    void clearErrors();

    /**
     * Indicates whether the component is currently operational.
     *
     * @return true if the component is healthy.
     */
    boolean isHealthy();
}
