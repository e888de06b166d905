package org.urbanscope.datapipeline.services.reporting;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable summary of one harvest batch.
 *
 * @param tag         batch tag (window and start time)
 * @param status      {@code completed} or {@code aborted}
 * @param startedUtc  ISO-8601 start time
 * @param finishedUtc ISO-8601 end time
 * @param query       catalog query
 * @param counters    run counters, in reporting order
 * @param resources   metrics per resource name
 * @param error       abort cause, {@code null} when completed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunReport(
    @JsonProperty("tag") String tag,
    @JsonProperty("status") String status,
    @JsonProperty("started_utc") String startedUtc,
    @JsonProperty("finished_utc") String finishedUtc,
    @JsonProperty("query") String query,
    @JsonProperty("counters") Map<String, Long> counters,
    @JsonProperty("resources") Map<String, Map<String, Number>> resources,
    @JsonProperty("error") String error
) {

    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_ABORTED = "aborted";

    public RunReport {
        counters = Collections.unmodifiableMap(new LinkedHashMap<>(counters));
        resources = resources == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(resources));
    }

    public long counter(String name) {
        return counters.getOrDefault(name, 0L);
    }
}
