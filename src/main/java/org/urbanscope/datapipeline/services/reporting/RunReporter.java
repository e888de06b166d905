package org.urbanscope.datapipeline.services.reporting;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanscope.datapipeline.api.contracts.Decision;
import org.urbanscope.datapipeline.utils.AtomicFiles;
import org.urbanscope.datapipeline.utils.JsonMapper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Counters and decision trail of a harvest batch.
 * <p>
 * All standard counters exist from the start with value zero, so a report always shows the
 * full set even when nothing happened.
 */
public class RunReporter {

    private static final Logger log = LoggerFactory.getLogger(RunReporter.class);

    public static final String RAW_INPUT = "raw_input";
    public static final String RAW_NEW = "raw_new";
    public static final String RESOLVED = "resolved";
    public static final String RESOLVED_TIER1 = "resolved_tier1";
    public static final String RESOLVED_TIER2 = "resolved_tier2";
    public static final String RESOLVED_TIER3 = "resolved_tier3";
    public static final String RESOLUTION_CACHE_HITS = "resolution_cache_hits";
    public static final String DROPPED_UNRESOLVED = "dropped_unresolved";
    public static final String DROPPED_DUPLICATE_PERSISTED = "dropped_duplicate_persisted";
    public static final String DROPPED_DUPLICATE_IN_BATCH = "dropped_duplicate_in_batch";
    public static final String DROPPED_FETCH_ERROR = "dropped_fetch_error";
    public static final String EMITTED = "emitted";

    private static final List<String> STANDARD_COUNTERS = List.of(
        RAW_INPUT, RAW_NEW, RESOLVED, RESOLVED_TIER1, RESOLVED_TIER2, RESOLVED_TIER3,
        RESOLUTION_CACHE_HITS, DROPPED_UNRESOLVED, DROPPED_DUPLICATE_PERSISTED,
        DROPPED_DUPLICATE_IN_BATCH, DROPPED_FETCH_ERROR, EMITTED);

    private final String tag;
    private final String query;
    private final Instant started;
    private final Map<String, Long> counters = new LinkedHashMap<>();
    private final List<Decision> decisions = new ArrayList<>();

    public RunReporter(String tag, String query, Instant started) {
        this.tag = tag;
        this.query = query;
        this.started = started;
        STANDARD_COUNTERS.forEach(name -> counters.put(name, 0L));
    }

    public void increment(String counter) {
        add(counter, 1);
    }

    public void add(String counter, long delta) {
        counters.merge(counter, delta, Long::sum);
    }

    public long get(String counter) {
        return counters.getOrDefault(counter, 0L);
    }

    public void record(Decision decision) {
        decisions.add(decision);
        log.debug("Decision for {}: {}{}", decision.rawId(), decision.decision(),
            decision.reason() == null ? "" : " (" + decision.reason().code() + ")");
    }

    public List<Decision> getDecisions() {
        return Collections.unmodifiableList(decisions);
    }

    public String getTag() {
        return tag;
    }

    /**
     * Logs all counters on one INFO line.
     */
    public void logSummary() {
        String summary = counters.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(", "));
        log.info("Run {} counters: {}", tag, summary);
    }

    public RunReport toReport(String status, Map<String, Map<String, Number>> resourceMetrics, String error,
                              Instant finished) {
        return new RunReport(tag, status,
            started.truncatedTo(ChronoUnit.SECONDS).toString(),
            finished.truncatedTo(ChronoUnit.SECONDS).toString(),
            query, counters, resourceMetrics, error);
    }

    /**
     * Writes {@code report_<tag>.json} and {@code decision_log_<tag>.ndjson} into {@code debugDir}.
     */
    public void writeDebugFiles(Path debugDir, RunReport report) throws IOException {
        String safeTag = fileSafe(tag);
        AtomicFiles.write(debugDir.resolve("report_" + safeTag + ".json"),
            JsonMapper.pretty().writeValueAsBytes(report));
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (SequenceWriter lines = JsonMapper.compact().withRootValueSeparator("\n").writeValues(buffer)) {
            for (Decision decision : decisions) {
                lines.write(decision);
            }
        }
        if (!decisions.isEmpty()) {
            buffer.write('\n');
        }
        AtomicFiles.write(debugDir.resolve("decision_log_" + safeTag + ".ndjson"), buffer.toByteArray());
    }

    /**
     * Writes the aggregate of all batch reports of a run.
     */
    public static void writeLatestReport(Path target, List<RunReport> reports, Instant generated) throws IOException {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("generated_utc", generated.truncatedTo(ChronoUnit.SECONDS).toString());
        Map<String, Long> totals = new LinkedHashMap<>();
        for (RunReport report : reports) {
            report.counters().forEach((k, v) -> totals.merge(k, v, Long::sum));
        }
        ObjectNode totalsNode = root.putObject("totals");
        totals.forEach(totalsNode::put);
        ArrayNode runs = root.putArray("runs");
        for (RunReport report : reports) {
            runs.add(JsonMapper.mapper().valueToTree(report));
        }
        AtomicFiles.write(target, JsonMapper.pretty().writeValueAsBytes(root));
    }

    static String fileSafe(String s) {
        return s.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
