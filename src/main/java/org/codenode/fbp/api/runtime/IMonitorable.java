package org.codenode.fbp.api.runtime;

import java.util.List;
import java.util.Map;

/**
 * A component that exposes metrics, recorded errors and a health flag.
 * <p>
 * Node runtimes implement this so that a controlling layer can inspect throughput and
 * failures of every live node without knowing its data types.
 */
public interface IMonitorable {

    /**
     * Returns a snapshot of the component's metrics.
     * <p>
     * Keys are metric names such as {@code "cycles"} or {@code "items_sent"}; the map is a copy
     * and may be modified by the caller.
     *
     * @return A map of metric names to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * Returns the operational errors recorded so far, oldest first.
     *
     * @return A copy of the recorded {@link OperationalError}s.
     */
    List<OperationalError> getErrors();

    /**
     * Discards all recorded errors.
     */
    void clearErrors();

    /**
     * @return {@code false} if the component failed or has recorded errors.
     */
    boolean isHealthy();
}
