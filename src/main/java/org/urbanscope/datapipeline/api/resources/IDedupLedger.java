package org.urbanscope.datapipeline.api.resources;

import java.io.IOException;
import java.util.Collection;

/**
 * Persisted sets of already-seen keys, one per {@link LedgerNamespace}.
 * <p>
 * {@link #markSeen} only stages keys. They become visible to {@link #contains} immediately,
 * but reach disk on {@link #flush()}, which the pipeline calls only after the record log
 * has accepted the batch.
 */
public interface IDedupLedger extends IPersistentResource {

    boolean contains(LedgerNamespace namespace, String key);

    /**
     * Stages keys as seen. Keys already present are ignored.
     */
    void markSeen(LedgerNamespace namespace, Collection<String> keys);

    int size(LedgerNamespace namespace);

    /**
     * Adds ids that are present in the record log but missing from the ledger, and persists them.
     * Covers a crash between the log append and the ledger flush.
     *
     * @param recordLog the durable log to compare against
     * @return number of ids that were missing, over both namespaces
     * @throws IOException if the log cannot be read or the ledger cannot be written
     */
    int reconcile(IRecordLog recordLog) throws IOException;
}
