package org.urbanscope.datapipeline.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.urbanscope.datapipeline.TestRecords;
import org.urbanscope.datapipeline.api.contracts.AssayCategory;
import org.urbanscope.datapipeline.api.contracts.EnrichedRecord;
import org.urbanscope.datapipeline.api.contracts.RawRecord;
import org.urbanscope.datapipeline.api.resources.LedgerNamespace;
import org.urbanscope.datapipeline.api.resources.source.SourceUnavailableException;
import org.urbanscope.datapipeline.api.resources.source.TimeWindow;
import org.urbanscope.datapipeline.resources.cache.FileSystemCacheStore;
import org.urbanscope.datapipeline.resources.ledger.FileDedupLedger;
import org.urbanscope.datapipeline.resources.log.JsonlRecordLog;
import org.urbanscope.datapipeline.services.export.ExportManifest;
import org.urbanscope.datapipeline.services.export.ExportService;
import org.urbanscope.datapipeline.services.export.ExportSettings;
import org.urbanscope.datapipeline.services.reporting.RunReport;
import org.urbanscope.datapipeline.services.reporting.RunReporter;
import org.urbanscope.datapipeline.utils.JsonMapper;
import org.urbanscope.junit.extensions.logging.ExpectLog;
import org.urbanscope.junit.extensions.logging.LogLevel;
import org.urbanscope.junit.extensions.logging.LogWatchExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class HarvestPipelineTest {

    private static final TimeWindow WINDOW = TimeWindow.recent(7);

    @TempDir
    Path tempDir;

    private FakeSourceClient source;
    private HarvestSettings settings;

    @BeforeEach
    void setUp() {
        source = new FakeSourceClient();
        settings = new HarvestSettings("urban metagenome", 500, false, false, false, false,
            tempDir.resolve("data/debug"), tempDir.resolve("docs/debug/latest_report.json"), 100, true, "test-source");
    }

    private JsonlRecordLog recordLog() {
        return new JsonlRecordLog("catalog", ConfigFactory.parseMap(Map.of("directory", tempDir.resolve("data/catalog").toString())));
    }

    private FileDedupLedger ledger() throws IOException {
        FileDedupLedger ledger = new FileDedupLedger("ledger", ConfigFactory.parseMap(Map.of("directory", tempDir.resolve("data").toString())));
        ledger.load();
        return ledger;
    }

    /** A fresh pipeline over the same directories, as a new process would build it. */
    private HarvestPipeline pipeline(HarvestSettings harvestSettings) throws IOException {
        FileSystemCacheStore cache = new FileSystemCacheStore("cache",
            ConfigFactory.parseMap(Map.of("directory", tempDir.resolve("data/cache").toString())));
        FileDedupLedger ledger = new FileDedupLedger("ledger",
            ConfigFactory.parseMap(Map.of("directory", tempDir.resolve("data").toString())));
        Clock clock = Clock.fixed(TestRecords.INGESTED, ZoneOffset.UTC);
        ExportService exports = new ExportService(new ExportSettings(tempDir.resolve("docs/db"),
            tempDir.resolve("docs/latest.json"), "records", 50_000_000, 2_000_000, 200), clock);
        HarvestPipeline pipeline = new HarvestPipeline(harvestSettings, source, cache, ledger, recordLog(), exports, clock);
        pipeline.open();
        return pipeline;
    }

    private List<EnrichedRecord> corpus() throws IOException {
        List<EnrichedRecord> records = new ArrayList<>();
        recordLog().readAll(records::add);
        return records;
    }

    private void addResolvable(String rawId, String accession) {
        source.add(TestRecords.raw(rawId, accession));
    }

    private void addUnresolvable(String rawId) {
        source.add(RawRecord.of(rawId, "Untitled swab", Map.of("LibraryStrategy", "WGS")));
    }

    @Test
    void runBatch_keepsOneRecordPerProjectAndCountsEveryOutcome() throws IOException {
        addResolvable("SRR1", "PRJNA1");
        addResolvable("SRR2", "PRJNA1");
        addUnresolvable("SRR3");
        addResolvable("SRR4", "PRJEB4");

        RunReport report = pipeline(settings).runBatch(WINDOW);

        assertThat(report.status()).isEqualTo(RunReport.STATUS_COMPLETED);
        assertThat(report.tag()).isEqualTo("recent7d_20240517T083000Z");
        assertThat(report.counter(RunReporter.RAW_INPUT)).isEqualTo(4);
        assertThat(report.counter(RunReporter.RAW_NEW)).isEqualTo(4);
        assertThat(report.counter(RunReporter.RESOLVED)).isEqualTo(3);
        assertThat(report.counter(RunReporter.RESOLVED_TIER1)).isEqualTo(3);
        assertThat(report.counter(RunReporter.DROPPED_UNRESOLVED)).isEqualTo(1);
        assertThat(report.counter(RunReporter.DROPPED_DUPLICATE_IN_BATCH)).isEqualTo(1);
        assertThat(report.counter(RunReporter.EMITTED)).isEqualTo(2);
        assertThat(report.resources()).containsKeys("cache", "ledger", "catalog", "enrichment");

        assertThat(corpus()).extracting(r -> r.raw().id()).containsExactly("SRR1", "SRR4");
        FileDedupLedger ledger = ledger();
        assertThat(ledger.size(LedgerNamespace.RAW)).isEqualTo(4);
        assertThat(ledger.contains(LedgerNamespace.PROJECT, "PRJNA1")).isTrue();
        assertThat(ledger.contains(LedgerNamespace.PROJECT, "PRJEB4")).isTrue();
    }

    /** Contents of the ledger files and every cache file, keyed by path relative to the data directory. */
    private Map<String, String> persistedState() throws IOException {
        Path data = tempDir.resolve("data");
        Map<String, String> state = new TreeMap<>();
        for (LedgerNamespace namespace : LedgerNamespace.values()) {
            Path file = data.resolve(namespace.fileName());
            state.put(namespace.fileName(), Files.readString(file));
        }
        try (Stream<Path> files = Files.walk(data.resolve("cache"))) {
            for (Path file : files.filter(Files::isRegularFile).collect(Collectors.toList())) {
                state.put(data.relativize(file).toString().replace('\\', '/'), Files.readString(file));
            }
        }
        return state;
    }

    @Test
    void rerun_onSameWindowLeavesLedgerCacheAndCorpusUnchanged() throws IOException {
        // Given
        ObjectNode project = JsonNodeFactory.instance.objectNode();
        project.put("title", "Subway microbiome");
        source.projects.put("PRJNA1", project);
        source.samples.put("SAMN01", JsonNodeFactory.instance.objectNode().put("title", "handrail swab"));
        source.add(RawRecord.of("SRR1", "Urban sample SRR1", Map.of("BioProject", "PRJNA1", "BioSample", "SAMN01")));
        addUnresolvable("SRR2");
        HarvestSettings enriching = settings.withFlags(true, true, false, false);
        pipeline(enriching).runBatch(WINDOW);
        Map<String, String> afterFirstRun = persistedState();
        int callsAfterFirstRun = source.detailCalls;

        // When
        RunReport second = pipeline(enriching).runBatch(WINDOW);

        // Then
        assertThat(afterFirstRun).containsKeys("cache/bioproject.json", "cache/biosample.json");
        assertThat(persistedState()).isEqualTo(afterFirstRun);
        assertThat(second.counter(RunReporter.RAW_INPUT)).isEqualTo(2);
        assertThat(second.counter(RunReporter.RAW_NEW)).isZero();
        assertThat(second.counter(RunReporter.EMITTED)).isZero();
        assertThat(source.detailCalls).isEqualTo(callsAfterFirstRun);
        assertThat(corpus()).hasSize(1);
    }

    @Test
    void laterRun_dropsRecordsOfProjectsAlreadyInCorpus() throws IOException {
        addResolvable("SRR1", "PRJNA1");
        pipeline(settings).runBatch(WINDOW);

        addResolvable("SRR9", "prjna1");
        RunReport second = pipeline(settings).runBatch(WINDOW);

        assertThat(second.counter(RunReporter.RAW_NEW)).isEqualTo(1);
        assertThat(second.counter(RunReporter.DROPPED_DUPLICATE_PERSISTED)).isEqualTo(1);
        assertThat(corpus()).extracting(r -> r.raw().id()).containsExactly("SRR1");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Dropping SRR2 after fetch failure.*")
    void fetchError_dropsOnlyThatRecordAndIsRetriedNextRun() throws IOException {
        addResolvable("SRR1", "PRJNA1");
        addResolvable("SRR2", "PRJNA2");
        source.failingIds.add("SRR2");

        RunReport first = pipeline(settings).runBatch(WINDOW);

        assertThat(first.status()).isEqualTo(RunReport.STATUS_COMPLETED);
        assertThat(first.counter(RunReporter.DROPPED_FETCH_ERROR)).isEqualTo(1);
        assertThat(first.counter(RunReporter.EMITTED)).isEqualTo(1);
        assertThat(ledger().contains(LedgerNamespace.RAW, "SRR2")).isFalse();

        source.failingIds.clear();
        RunReport second = pipeline(settings).runBatch(WINDOW);

        assertThat(second.counter(RunReporter.RAW_NEW)).isEqualTo(1);
        assertThat(second.counter(RunReporter.EMITTED)).isEqualTo(1);
        assertThat(corpus()).extracting(r -> r.raw().id()).containsExactly("SRR1", "SRR2");
    }

    @Test
    void crashMidBatch_keepsCommittedChunksAndResumes() throws IOException {
        HarvestSettings smallChunks = new HarvestSettings("urban", 500, false, false, false, false,
            settings.debugDir(), settings.latestReportFile(), 2, true, "test-source");
        for (int i = 1; i <= 5; i++) {
            addResolvable("SRR" + i, "PRJNA" + i);
        }
        source.crashOn = "SRR3";

        HarvestPipeline crashing = pipeline(smallChunks);
        assertThatThrownBy(() -> crashing.runBatch(WINDOW)).isInstanceOf(IllegalStateException.class);

        assertThat(crashing.getReports()).hasSize(1);
        RunReport aborted = crashing.getReports().get(0);
        assertThat(aborted.status()).isEqualTo(RunReport.STATUS_ABORTED);
        assertThat(aborted.error()).contains("simulated crash at SRR3");
        assertThat(aborted.counter(RunReporter.EMITTED)).isEqualTo(2);
        assertThat(corpus()).hasSize(2);
        assertThat(ledger().contains(LedgerNamespace.RAW, "SRR3")).isFalse();

        source.crashOn = null;
        RunReport resumed = pipeline(smallChunks).runBatch(WINDOW);

        assertThat(resumed.counter(RunReporter.RAW_NEW)).isEqualTo(3);
        assertThat(corpus()).extracting(r -> r.raw().id()).containsExactly("SRR1", "SRR2", "SRR3", "SRR4", "SRR5");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ledger 'ledger' was behind the record log.*")
    void open_reconcilesLedgerWithRecordLog() throws IOException {
        recordLog().append(2024, List.of(TestRecords.enriched("SRR1", "PRJNA1")));
        addResolvable("SRR1", "PRJNA1");
        addResolvable("SRR2", "PRJNA1");

        RunReport report = pipeline(settings).runBatch(WINDOW);

        assertThat(report.counter(RunReporter.RAW_NEW)).isEqualTo(1);
        assertThat(report.counter(RunReporter.DROPPED_DUPLICATE_PERSISTED)).isEqualTo(1);
        assertThat(corpus()).hasSize(1);
    }

    @Test
    void failedSearch_abortsWithoutTouchingState() throws IOException {
        addResolvable("SRR1", "PRJNA1");
        source.searchFails = true;
        HarvestPipeline pipeline = pipeline(settings);

        assertThatThrownBy(() -> pipeline.runBatch(WINDOW)).isInstanceOf(SourceUnavailableException.class);

        assertThat(pipeline.getReports()).singleElement()
            .satisfies(r -> assertThat(r.error()).contains("HTTP 503"));
        assertThat(corpus()).isEmpty();
        assertThat(tempDir.resolve("data/seen_raw_ids.txt")).doesNotExist();
    }

    @Test
    void enrichment_attachesMetadataClassificationAndLocation() throws IOException {
        ObjectNode project = JsonNodeFactory.instance.objectNode();
        project.put("title", "Subway microbiome");
        source.projects.put("PRJNA1", project);
        ObjectNode sample = JsonNodeFactory.instance.objectNode();
        sample.putObject("attributes").put("geo_loc_name", "USA: New York City").put("lat_lon", "40.71, -74.00");
        source.samples.put("SAMN01", sample);
        Map<String, String> fields = new HashMap<>();
        fields.put("BioProject", "PRJNA1");
        fields.put("BioSample", "SAMN01");
        fields.put("LibraryStrategy", "AMPLICON");
        source.add(RawRecord.of("SRR1", "16S rRNA gene survey of subway handrails", fields));

        HarvestSettings enriching = settings.withFlags(true, true, false, false);
        pipeline(enriching).runBatch(WINDOW);

        EnrichedRecord record = corpus().get(0);
        assertThat(record.projectMetadata().path("title").asText()).isEqualTo("Subway microbiome");
        assertThat(record.sampleMetadata().path("attributes").path("geo_loc_name").asText()).isEqualTo("USA: New York City");
        assertThat(record.classification().category()).isEqualTo(AssayCategory.SIXTEEN_S);
        assertThat(record.geo().country()).isEqualTo("United States");
        assertThat(record.geo().city()).isEqualTo("New York City");
        assertThat(record.geo().latitude()).isEqualTo("40.71");
        assertThat(record.provenance().source()).isEqualTo("test-source");
        assertThat(record.provenance().ingestedUtc()).isEqualTo("2024-05-17T08:30:00Z");
    }

    @Test
    void enrichment_withoutMetadataStillEmitsTheRecord() throws IOException {
        Map<String, String> fields = new HashMap<>();
        fields.put("BioProject", "PRJNA1");
        fields.put("BioSample", "SAMN404");
        source.add(RawRecord.of("SRR1", "Sewage sampling in London, England", fields));

        pipeline(settings.withFlags(true, true, false, false)).runBatch(WINDOW);

        EnrichedRecord record = corpus().get(0);
        assertThat(record.projectMetadata()).isNull();
        assertThat(record.sampleMetadata()).isNull();
        assertThat(record.geo().country()).isEqualTo("United Kingdom");
    }

    @Test
    void publish_writesRunReportAndExports() throws IOException {
        addResolvable("SRR1", "PRJNA1");
        HarvestPipeline pipeline = pipeline(settings);
        pipeline.runBatch(WINDOW);
        pipeline.runBatch(TimeWindow.page(0));

        ExportManifest manifest = pipeline.publish();

        assertThat(manifest.totalRecords()).isEqualTo(1);
        JsonNode report = JsonMapper.mapper().readTree(settings.latestReportFile().toFile());
        assertThat(report.path("runs").size()).isEqualTo(2);
        assertThat(report.path("totals").path(RunReporter.RAW_INPUT).asLong()).isEqualTo(2);
        assertThat(report.path("generated_utc").asText()).isEqualTo("2024-05-17T08:30:00Z");
        assertThat(report.path("runs").get(0).path("finished_utc").asText()).isEqualTo("2024-05-17T08:30:00Z");
        assertThat(manifest.generatedUtc()).isEqualTo("2024-05-17T08:30:00Z");
        assertThat(tempDir.resolve("docs/db/records_manifest.json")).exists();
        assertThat(tempDir.resolve("docs/latest.json")).exists();
    }

    @Test
    void debugMode_writesReportAndDecisionLog() throws IOException {
        addResolvable("SRR1", "PRJNA1");
        addUnresolvable("SRR2");

        RunReport report = pipeline(settings.withFlags(false, false, false, true)).runBatch(WINDOW);

        Path debugDir = settings.debugDir();
        assertThat(debugDir.resolve("report_" + report.tag() + ".json")).exists();
        assertThat(Files.readAllLines(debugDir.resolve("decision_log_" + report.tag() + ".ndjson"))).hasSize(2);
    }

    @Test
    void runBatch_beforeOpenIsRejected() {
        HarvestPipeline pipeline = new HarvestPipeline(settings, source,
            new FileSystemCacheStore("cache", ConfigFactory.parseMap(Map.of("directory", tempDir.toString()))),
            new FileDedupLedger("ledger", ConfigFactory.parseMap(Map.of("directory", tempDir.toString()))),
            recordLog(),
            new ExportService(new ExportSettings(tempDir, tempDir.resolve("latest.json"), "records", 1000, 1000, 1)),
            Clock.systemUTC());

        assertThatThrownBy(() -> pipeline.runBatch(WINDOW)).isInstanceOf(IllegalStateException.class);
    }
}
