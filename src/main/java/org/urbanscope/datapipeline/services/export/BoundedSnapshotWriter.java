package org.urbanscope.datapipeline.services.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanscope.datapipeline.utils.AtomicFiles;
import org.urbanscope.datapipeline.utils.JsonMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Writes a single-file JSON snapshot {@code {generated_utc, count, included, items}} that must
 * stay within a byte ceiling.
 * <p>
 * The largest prefix of {@code items} whose serialized document fits is found by binary search
 * over the prefix length. {@code count} is the number of candidate items, {@code included} the
 * number actually written.
 */
public class BoundedSnapshotWriter {

    private static final Logger log = LoggerFactory.getLogger(BoundedSnapshotWriter.class);

    /**
     * @param included items written
     * @param bytes    size of the written file
     */
    public record SnapshotResult(int included, long bytes) {
    }

    private final ObjectWriter writer;
    private final Clock clock;

    public BoundedSnapshotWriter() {
        this(JsonMapper.pretty(), Clock.systemUTC());
    }

    public BoundedSnapshotWriter(ObjectWriter writer, Clock clock) {
        this.writer = writer;
        this.clock = clock;
    }

    /**
     * Writes the snapshot atomically.
     *
     * @param target   output file
     * @param items    candidate items in priority order (a prefix is kept)
     * @param maxBytes ceiling for the whole file
     */
    public SnapshotResult write(Path target, List<? extends JsonNode> items, long maxBytes) throws IOException {
        String generated = clock.instant().truncatedTo(ChronoUnit.SECONDS).toString();
        int lo = 0;
        int hi = items.size();
        byte[] best = serialize(generated, items, 0);
        if (best.length > maxBytes) {
            log.warn("Snapshot header alone exceeds {} bytes, writing it without items", maxBytes);
        } else {
            // invariant: prefix lo fits; every prefix above hi does not
            while (lo < hi) {
                int mid = lo + (hi - lo + 1) / 2;
                byte[] candidate = serialize(generated, items, mid);
                if (candidate.length <= maxBytes) {
                    lo = mid;
                    best = candidate;
                } else {
                    hi = mid - 1;
                }
            }
        }
        AtomicFiles.write(target, best);
        if (lo < items.size()) {
            log.debug("Snapshot {} truncated to {} of {} items to stay within {} bytes",
                target.getFileName(), lo, items.size(), maxBytes);
        }
        return new SnapshotResult(lo, best.length);
    }

    private byte[] serialize(String generated, List<? extends JsonNode> items, int count) throws IOException {
        ObjectNode doc = JsonNodeFactory.instance.objectNode();
        doc.put("generated_utc", generated);
        doc.put("count", items.size());
        doc.put("included", count);
        ArrayNode array = doc.putArray("items");
        for (int i = 0; i < count; i++) {
            array.add(items.get(i));
        }
        return writer.writeValueAsBytes(doc);
    }
}
