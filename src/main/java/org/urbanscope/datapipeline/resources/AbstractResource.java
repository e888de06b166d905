package org.urbanscope.datapipeline.resources;

import com.typesafe.config.Config;
import org.urbanscope.datapipeline.api.resources.IMonitorable;
import org.urbanscope.datapipeline.api.resources.IResource;
import org.urbanscope.datapipeline.api.resources.OperationalError;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Base class for resource implementations: name and options handling, bounded error
 * tracking and the metrics hook.
 * <p>
 * <strong>Error handling guidelines for resources:</strong>
 * <ul>
 *   <li>Transient errors (the resource keeps working, the caller may drop one record):
 *       {@code log.warn(...)} without the exception, {@link #recordError} to track, then throw
 *       so the caller can isolate the failure.</li>
 *   <li>Fatal errors (local I/O on cache, ledger or log files): throw, do not record.
 *       The CLI logs them at ERROR.</li>
 *   <li>Retry attempts: {@code log.debug(...)} only.</li>
 * </ul>
 * Stack traces are only ever logged at DEBUG.
 */
public abstract class AbstractResource implements IResource, IMonitorable {

    protected final String resourceName;
    protected final Config options;

    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * Constructor for AbstractResource.
     *
     * @param name    The configured name of the resource instance.
     * @param options The configuration sub-tree for this instance.
     */
    protected AbstractResource(String name, Config options) {
        this.resourceName = Objects.requireNonNull(name, "Resource name cannot be null");
        this.options = Objects.requireNonNull(options, "Resource options cannot be null");
    }

    /**
     * Maximum number of errors kept in memory. Oldest entries are evicted first.
     */
    protected int getMaxErrors() {
        return 1000;
    }

    @Override
    public String getResourceName() {
        return resourceName;
    }

    public Config getOptions() {
        return options;
    }

    /**
     * Records a transient operational error. Use only when the resource stays usable.
     *
     * @param code    Error code for categorization (e.g. "SOURCE_UNAVAILABLE")
     * @param message Human-readable error message
     * @param details Additional context, may be {@code null}
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    /**
     * A resource is healthy while it has no recorded errors.
     */
    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for subclasses to add resource-specific metrics. Call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map that already contains the base metrics
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // no custom metrics by default
    }
}
