package org.urbanscope.datapipeline.services.aggregation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanscope.datapipeline.api.contracts.CanonicalProjectId;
import org.urbanscope.datapipeline.api.contracts.Decision;
import org.urbanscope.datapipeline.api.contracts.DropReason;
import org.urbanscope.datapipeline.api.resources.IDedupLedger;
import org.urbanscope.datapipeline.api.resources.LedgerNamespace;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collapses a batch to at most one record per canonical project.
 * <p>
 * A record is kept iff it is resolved, its project is not in the ledger, and no earlier record
 * of the same batch was kept for that project. Kept projects are staged in the ledger
 * immediately; they reach disk only when the pipeline flushes the ledger.
 */
public class CollapsingAggregator {

    private static final Logger log = LoggerFactory.getLogger(CollapsingAggregator.class);

    public AggregationResult aggregate(List<ResolvedRecord> batch, IDedupLedger ledger) {
        List<ResolvedRecord> kept = new ArrayList<>();
        List<Decision> decisions = new ArrayList<>(batch.size());
        Set<CanonicalProjectId> keptInBatch = new HashSet<>();

        for (ResolvedRecord record : batch) {
            String rawId = record.raw().id();
            if (!record.resolution().isResolved()) {
                decisions.add(Decision.dropped(rawId, DropReason.UNRESOLVED, record.resolution()));
                continue;
            }
            CanonicalProjectId project = record.resolution().projectId();
            if (keptInBatch.contains(project)) {
                log.debug("Dropping {}: project {} already kept in this batch", rawId, project);
                decisions.add(Decision.dropped(rawId, DropReason.DUPLICATE_IN_BATCH, record.resolution()));
                continue;
            }
            if (ledger.contains(LedgerNamespace.PROJECT, project.value())) {
                log.debug("Dropping {}: project {} already in corpus", rawId, project);
                decisions.add(Decision.dropped(rawId, DropReason.DUPLICATE_PERSISTED, record.resolution()));
                continue;
            }
            keptInBatch.add(project);
            ledger.markSeen(LedgerNamespace.PROJECT, List.of(project.value()));
            kept.add(record);
            decisions.add(Decision.kept(rawId, record.resolution()));
        }
        return new AggregationResult(kept, decisions);
    }
}
