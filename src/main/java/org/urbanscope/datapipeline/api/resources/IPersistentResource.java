package org.urbanscope.datapipeline.api.resources;

import java.io.IOException;

/**
 * A resource whose state lives on disk between runs.
 * <p>
 * {@link #load()} is called once before the pipeline reads the resource. {@link #flush()} makes
 * pending in-memory changes durable. Failures on either are local I/O errors and are fatal
 * to the run.
 */
public interface IPersistentResource extends IResource {

    /**
     * Loads persisted state. Missing files mean empty state, not an error.
     *
     * @throws IOException if existing files cannot be read or parsed.
     */
    void load() throws IOException;

    /**
     * Makes pending changes durable.
     *
     * @throws IOException if writing fails.
     */
    void flush() throws IOException;
}
