package org.urbanscope.datapipeline.services.aggregation;

import org.urbanscope.datapipeline.api.contracts.Decision;
import org.urbanscope.datapipeline.api.contracts.DropReason;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link CollapsingAggregator#aggregate}.
 *
 * @param kept      surviving records, in batch order
 * @param decisions one decision per input record, in batch order
 */
public record AggregationResult(List<ResolvedRecord> kept, List<Decision> decisions) {

    public AggregationResult {
        kept = List.copyOf(kept);
        decisions = List.copyOf(decisions);
    }

    public Map<DropReason, Integer> dropCounts() {
        Map<DropReason, Integer> counts = new EnumMap<>(DropReason.class);
        for (DropReason reason : DropReason.values()) {
            counts.put(reason, 0);
        }
        for (Decision decision : decisions) {
            if (!decision.kept()) {
                counts.merge(decision.reason(), 1, Integer::sum);
            }
        }
        return counts;
    }
}
