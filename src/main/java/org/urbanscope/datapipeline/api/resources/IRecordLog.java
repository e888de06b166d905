package org.urbanscope.datapipeline.api.resources;

import org.urbanscope.datapipeline.api.contracts.EnrichedRecord;

import java.io.IOException;
import java.util.List;
import java.util.SortedSet;
import java.util.function.Consumer;

/**
 * Append-only, period-partitioned, size-rotated log of enriched records.
 * The log is the source of truth for the corpus; exports are rebuilt from it.
 */
public interface IRecordLog extends IResource {

    /**
     * Appends records to the segment of the given period, rotating segments at the size limit.
     * Returns only after the data has been forced to disk.
     *
     * @param period  calendar year of ingestion
     * @param records records to append, in order
     * @throws IOException if the segment cannot be written
     */
    void append(int period, List<EnrichedRecord> records) throws IOException;

    /**
     * Streams every persisted record, ordered by period, then segment, then line.
     *
     * @param visitor receives each record
     * @throws IOException if a segment cannot be read or a line does not parse
     */
    void readAll(Consumer<EnrichedRecord> visitor) throws IOException;

    /**
     * Periods that have at least one segment on disk.
     */
    SortedSet<Integer> periods() throws IOException;
}
