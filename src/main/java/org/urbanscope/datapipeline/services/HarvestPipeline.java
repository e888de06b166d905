package org.urbanscope.datapipeline.services;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanscope.datapipeline.api.contracts.ClassificationResult;
import org.urbanscope.datapipeline.api.contracts.Decision;
import org.urbanscope.datapipeline.api.contracts.DropReason;
import org.urbanscope.datapipeline.api.contracts.EnrichedRecord;
import org.urbanscope.datapipeline.api.contracts.GeoGuess;
import org.urbanscope.datapipeline.api.contracts.Provenance;
import org.urbanscope.datapipeline.api.contracts.RawRecord;
import org.urbanscope.datapipeline.api.contracts.ResolutionResult;
import org.urbanscope.datapipeline.api.resources.ICacheStore;
import org.urbanscope.datapipeline.api.resources.IDedupLedger;
import org.urbanscope.datapipeline.api.resources.IMonitorable;
import org.urbanscope.datapipeline.api.resources.IRecordLog;
import org.urbanscope.datapipeline.api.resources.IResource;
import org.urbanscope.datapipeline.api.resources.LedgerNamespace;
import org.urbanscope.datapipeline.api.resources.source.ISourceClient;
import org.urbanscope.datapipeline.api.resources.source.MalformedPayloadException;
import org.urbanscope.datapipeline.api.resources.source.SourceUnavailableException;
import org.urbanscope.datapipeline.api.resources.source.TimeWindow;
import org.urbanscope.datapipeline.services.aggregation.AggregationResult;
import org.urbanscope.datapipeline.services.aggregation.CollapsingAggregator;
import org.urbanscope.datapipeline.services.aggregation.ResolvedRecord;
import org.urbanscope.datapipeline.services.classifier.AssayClassifier;
import org.urbanscope.datapipeline.services.classifier.GeoInference;
import org.urbanscope.datapipeline.services.enrichment.ProjectMetadataEnricher;
import org.urbanscope.datapipeline.services.enrichment.SampleMetadataEnricher;
import org.urbanscope.datapipeline.services.export.ExportManifest;
import org.urbanscope.datapipeline.services.export.ExportService;
import org.urbanscope.datapipeline.services.reporting.RunReport;
import org.urbanscope.datapipeline.services.reporting.RunReporter;
import org.urbanscope.datapipeline.services.resolver.EntityResolver;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One harvest batch end to end: search, resolve, collapse, enrich, classify, commit.
 * <p>
 * <strong>Commit order.</strong> Kept records are appended to the record log first, then the
 * processed raw ids and kept project ids are appended to the ledger, then the caches are
 * rewritten. Nothing is persisted before that point, so a crash while records are being fetched
 * or enriched leaves the log and ledger as they were. A crash between the log append and the
 * ledger append is repaired by {@link IDedupLedger#reconcile(IRecordLog)} on the next start.
 * <p>
 * <strong>Failures.</strong> A failed search or any local I/O error aborts the batch. A fetch or
 * resolution failure for one raw id drops only that record ({@code fetch_error}); its raw id is not
 * marked seen, so the next run tries it again. Counters are logged in every case.
 */
public class HarvestPipeline {

    private static final Logger log = LoggerFactory.getLogger(HarvestPipeline.class);
    private static final DateTimeFormatter TAG_TIME = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private final HarvestSettings settings;
    private final ISourceClient source;
    private final ICacheStore cache;
    private final IDedupLedger ledger;
    private final IRecordLog recordLog;
    private final ExportService exportService;
    private final Clock clock;

    private final EntityResolver resolver;
    private final CollapsingAggregator aggregator = new CollapsingAggregator();
    private final AssayClassifier classifier = new AssayClassifier();
    private final GeoInference geoInference = new GeoInference();
    private final ProjectMetadataEnricher projectEnricher;
    private final SampleMetadataEnricher sampleEnricher;

    private final List<RunReport> reports = new ArrayList<>();
    private boolean opened;

    public HarvestPipeline(HarvestSettings settings, ISourceClient source, ICacheStore cache, IDedupLedger ledger,
                           IRecordLog recordLog, ExportService exportService, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger cannot be null");
        this.recordLog = Objects.requireNonNull(recordLog, "recordLog cannot be null");
        this.exportService = Objects.requireNonNull(exportService, "exportService cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.resolver = new EntityResolver(source, cache, settings.deepFallback());
        this.projectEnricher = new ProjectMetadataEnricher(source, cache);
        this.sampleEnricher = new SampleMetadataEnricher(source, cache);
    }

    /**
     * Loads cache and ledger, and reconciles the ledger with the record log if configured.
     */
    public void open() throws IOException {
        cache.load();
        ledger.load();
        if (settings.reconcileLedgerOnLoad()) {
            ledger.reconcile(recordLog);
        }
        opened = true;
        log.info("Pipeline ready: {} raw ids and {} projects already seen",
            ledger.size(LedgerNamespace.RAW), ledger.size(LedgerNamespace.PROJECT));
    }

    /**
     * Runs one batch for a search window.
     *
     * @return the batch report
     * @throws IOException if the search fails or local state cannot be written; the batch is aborted
     */
    public RunReport runBatch(TimeWindow window) throws IOException {
        if (!opened) {
            throw new IllegalStateException("open() must be called before runBatch()");
        }
        Instant started = clock.instant();
        RunReporter reporter = new RunReporter(window.tag() + "_" + TAG_TIME.format(started), settings.query(), started);
        String status = RunReport.STATUS_ABORTED;
        String error = null;
        RunReport report = null;
        try {
            List<String> ids = source.search(settings.query(), window, settings.limit());
            reporter.add(RunReporter.RAW_INPUT, ids.size());

            List<String> fresh = new ArrayList<>();
            for (String id : new LinkedHashSet<>(ids)) {
                if (!ledger.contains(LedgerNamespace.RAW, id)) {
                    fresh.add(id);
                }
            }
            reporter.add(RunReporter.RAW_NEW, fresh.size());
            log.info("Batch {}: {} ids from search, {} new", reporter.getTag(), ids.size(), fresh.size());

            for (int from = 0; from < fresh.size(); from += settings.flushEveryRecords()) {
                List<String> chunk = fresh.subList(from, Math.min(fresh.size(), from + settings.flushEveryRecords()));
                processChunk(chunk, reporter);
            }
            status = RunReport.STATUS_COMPLETED;
        } catch (IOException | RuntimeException e) {
            error = e.getClass().getSimpleName() + ": " + e.getMessage();
            throw e;
        } finally {
            reporter.logSummary();
            report = reporter.toReport(status, resourceMetrics(), error, clock.instant());
            reports.add(report);
            if (settings.debug()) {
                writeDebugFilesQuietly(reporter, report, error != null);
            }
        }
        return report;
    }

    private void writeDebugFilesQuietly(RunReporter reporter, RunReport report, boolean aborting) throws IOException {
        try {
            reporter.writeDebugFiles(settings.debugDir(), report);
        } catch (IOException e) {
            if (!aborting) {
                throw e;
            }
            log.warn("Could not write debug files for aborted batch {}: {}", reporter.getTag(), e.getMessage());
        }
    }

    private void processChunk(List<String> rawIds, RunReporter reporter) throws IOException {
        List<ResolvedRecord> resolved = new ArrayList<>();
        for (String rawId : rawIds) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("Harvest interrupted before " + rawId);
            }
            try {
                RawRecord raw = source.fetchDetail(rawId);
                ResolutionResult resolution = resolver.resolve(raw);
                countResolution(resolution, reporter);
                resolved.add(new ResolvedRecord(raw, resolution));
            } catch (SourceUnavailableException | MalformedPayloadException e) {
                log.warn("Dropping {} after fetch failure: {}", rawId, e.getMessage());
                reporter.increment(RunReporter.DROPPED_FETCH_ERROR);
                reporter.record(Decision.fetchError(rawId, e.getMessage()));
            }
        }

        AggregationResult aggregation = aggregator.aggregate(resolved, ledger);
        aggregation.decisions().forEach(reporter::record);
        Map<DropReason, Integer> drops = aggregation.dropCounts();
        reporter.add(RunReporter.DROPPED_UNRESOLVED, drops.get(DropReason.UNRESOLVED));
        reporter.add(RunReporter.DROPPED_DUPLICATE_PERSISTED, drops.get(DropReason.DUPLICATE_PERSISTED));
        reporter.add(RunReporter.DROPPED_DUPLICATE_IN_BATCH, drops.get(DropReason.DUPLICATE_IN_BATCH));

        Instant now = clock.instant();
        List<EnrichedRecord> enriched = new ArrayList<>();
        for (ResolvedRecord record : aggregation.kept()) {
            enriched.add(enrich(record, now));
        }

        List<String> processedRawIds = new ArrayList<>();
        resolved.forEach(r -> processedRawIds.add(r.raw().id()));
        commit(enriched, processedRawIds);
        reporter.add(RunReporter.EMITTED, enriched.size());
    }

    private void countResolution(ResolutionResult resolution, RunReporter reporter) {
        if (!resolution.isResolved()) {
            return;
        }
        reporter.increment(RunReporter.RESOLVED);
        switch (resolution.method()) {
            case EMBEDDED_FIELD -> reporter.increment(RunReporter.RESOLVED_TIER1);
            case LINK_LOOKUP -> reporter.increment(RunReporter.RESOLVED_TIER2);
            case FULL_TEXT -> reporter.increment(RunReporter.RESOLVED_TIER3);
            default -> throw new IllegalStateException("Resolved result with method " + resolution.method());
        }
        if (resolution.cacheHit()) {
            reporter.increment(RunReporter.RESOLUTION_CACHE_HITS);
        }
    }

    EnrichedRecord enrich(ResolvedRecord record, Instant ingested) {
        RawRecord raw = record.raw();
        JsonNode project = null;
        if (settings.fetchBioproject()) {
            project = projectEnricher.enrich(record.resolution().projectId()).orElse(null);
        }
        JsonNode sample = null;
        if (settings.fetchBiosample()) {
            sample = sampleEnricher.enrich(raw.field(SampleMetadataEnricher.FIELD_SAMPLE)).orElse(null);
        }
        Map<String, String> sampleAttributes = SampleMetadataEnricher.attributesOf(sample);
        ClassificationResult classification = classifier.classify(raw, sampleAttributes);

        Map<String, String> geoAttributes = new LinkedHashMap<>(raw.fields());
        geoAttributes.putAll(sampleAttributes);
        List<String> fallbacks = new ArrayList<>(List.of(
            raw.title(), raw.field("SampleName"), raw.field("Sample"), raw.field("Study"), raw.field("BioProject")));
        Optional.ofNullable(project).map(p -> p.path("title").asText("")).ifPresent(fallbacks::add);
        GeoGuess geo = geoInference.infer(geoAttributes, fallbacks);

        return new EnrichedRecord(raw, record.resolution(), classification, geo, project, sample,
            Provenance.at(ingested, settings.sourceTag()));
    }

    private void commit(List<EnrichedRecord> enriched, List<String> processedRawIds) throws IOException {
        Map<Integer, List<EnrichedRecord>> byPeriod = new TreeMap<>();
        for (EnrichedRecord record : enriched) {
            byPeriod.computeIfAbsent(record.provenance().period(), p -> new ArrayList<>()).add(record);
        }
        for (Map.Entry<Integer, List<EnrichedRecord>> period : byPeriod.entrySet()) {
            recordLog.append(period.getKey(), period.getValue());
        }
        ledger.markSeen(LedgerNamespace.RAW, processedRawIds);
        ledger.flush();
        cache.flush();
        log.debug("Committed {} records and {} raw ids", enriched.size(), processedRawIds.size());
    }

    /**
     * Reports of all batches run so far, including aborted ones.
     */
    public List<RunReport> getReports() {
        return List.copyOf(reports);
    }

    /**
     * Writes {@code latest_report.json} aggregating every batch of this run.
     */
    public void writeRunReport() throws IOException {
        RunReporter.writeLatestReport(settings.latestReportFile(), reports, clock.instant());
    }

    /**
     * Writes the run report and rebuilds all exports from the record log.
     */
    public ExportManifest publish() throws IOException {
        writeRunReport();
        return exportService.rebuild(recordLog, cache);
    }

    private Map<String, Map<String, Number>> resourceMetrics() {
        Map<String, Map<String, Number>> metrics = new LinkedHashMap<>();
        for (Object resource : List.of(source, cache, ledger, recordLog)) {
            if (resource instanceof IMonitorable monitorable && resource instanceof IResource named) {
                metrics.put(named.getResourceName(), monitorable.getMetrics());
            }
        }
        Map<String, Number> enrichment = new LinkedHashMap<>();
        enrichment.putAll(projectEnricher.getCounters());
        enrichment.putAll(sampleEnricher.getCounters());
        metrics.put("enrichment", enrichment);
        return metrics;
    }
}
