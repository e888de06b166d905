package org.urbanscope.datapipeline.api.resources;

/**
 * Base interface for all resources used by the harvest pipeline.
 * <p>
 * Resources wrap state or systems outside the process: the remote catalog, the on-disk caches,
 * the dedup ledgers and the durable record log. Each instance carries the name it was
 * configured under so that log lines and reports can refer to it.
 */
public interface IResource {

    /**
     * Returns the configured name of this resource instance.
     *
     * @return The resource name, never {@code null}.
     */
    String getResourceName();
}
