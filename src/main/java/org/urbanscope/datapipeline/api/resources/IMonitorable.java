package org.urbanscope.datapipeline.api.resources;

import java.util.List;
import java.util.Map;

/**
 * An interface for components that expose metrics, errors and health.
 * <p>
 * The run report collects {@link #getMetrics()} from every resource once the run ends,
 * so metric names should be stable snake_case keys.
 */
public interface IMonitorable {

    /**
     * Returns a map of metrics for the component.
     *
     * @return A map of metric names to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * Returns the operational errors recorded since construction or the last {@link #clearErrors()}.
     *
     * @return A list of {@link OperationalError}s.
     */
    List<OperationalError> getErrors();

    /**
     * Clears the list of operational errors.
     */
    void clearErrors();

    /**
     * Indicates whether the component is currently operational.
     *
     * @return true if the component is healthy, false if it is in a degraded state.
     */
    boolean isHealthy();
}
