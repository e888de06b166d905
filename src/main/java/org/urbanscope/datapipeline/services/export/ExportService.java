package org.urbanscope.datapipeline.services.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanscope.datapipeline.api.contracts.EnrichedRecord;
import org.urbanscope.datapipeline.api.resources.ICacheStore;
import org.urbanscope.datapipeline.api.resources.IRecordLog;
import org.urbanscope.datapipeline.services.enrichment.ProjectMetadataEnricher;
import org.urbanscope.datapipeline.services.enrichment.SampleMetadataEnricher;
import org.urbanscope.datapipeline.utils.AtomicFiles;
import org.urbanscope.datapipeline.utils.JsonMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds every published artifact from the record log.
 * <ul>
 *   <li>{@code <prefix>_partNNN.json} and {@code records_manifest.json} via {@link ChunkedExporter}</li>
 *   <li>{@code records_index.json}: part names, totals and years</li>
 *   <li>{@code bioprojects.json}, {@code biosamples.json}: copies of the metadata caches</li>
 *   <li>the latest-items snapshot via {@link BoundedSnapshotWriter}, newest first</li>
 * </ul>
 * Part files left over from a larger previous export are deleted after the new manifest is in place.
 */
public class ExportService {

    private static final Logger log = LoggerFactory.getLogger(ExportService.class);
    private static final String PROJECT_URL = "https://www.ncbi.nlm.nih.gov/bioproject/";

    private final ExportSettings settings;
    private final Clock clock;
    private final BoundedSnapshotWriter snapshotWriter;

    public ExportService(ExportSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public ExportService(ExportSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        this.snapshotWriter = new BoundedSnapshotWriter(JsonMapper.pretty(), clock);
    }

    /**
     * Rebuilds all artifacts.
     *
     * @return the manifest that was written
     */
    public ExportManifest rebuild(IRecordLog recordLog, ICacheStore cache) throws IOException {
        Path dir = settings.databaseDir();
        Files.createDirectories(dir);

        Deque<EnrichedRecord> tail = new ArrayDeque<>();
        ExportManifest manifest;
        try (ChunkedExporter exporter = new ChunkedExporter(dir, settings.recordsPrefix(), settings.maxPartBytes(), JsonMapper.pretty(), clock)) {
            try {
                recordLog.readAll(record -> {
                    try {
                        exporter.write(record);
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                    if (settings.latestItems() > 0) {
                        tail.addLast(record);
                        if (tail.size() > settings.latestItems()) {
                            tail.removeFirst();
                        }
                    }
                });
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }
            manifest = exporter.finish().withYears(new ArrayList<>(recordLog.periods()));
        }

        AtomicFiles.write(dir.resolve("records_manifest.json"), JsonMapper.pretty().writeValueAsBytes(manifest));
        AtomicFiles.write(dir.resolve("records_index.json"), JsonMapper.pretty().writeValueAsBytes(index(manifest)));
        removeStaleParts(dir, manifest);

        writeCacheCopy(cache, ProjectMetadataEnricher.NAMESPACE, dir.resolve("bioprojects.json"));
        writeCacheCopy(cache, SampleMetadataEnricher.NAMESPACE, dir.resolve("biosamples.json"));

        List<ObjectNode> latest = new ArrayList<>();
        tail.descendingIterator().forEachRemaining(record -> latest.add(summaryItem(record)));
        BoundedSnapshotWriter.SnapshotResult snapshot =
            snapshotWriter.write(settings.latestFile(), latest, settings.maxLatestBytes());

        log.info("Exported {} records in {} parts to {}, latest snapshot holds {} of {} items",
            manifest.totalRecords(), manifest.parts().size(), dir, snapshot.included(), latest.size());
        return manifest;
    }

    private ObjectNode index(ExportManifest manifest) {
        ObjectNode index = JsonNodeFactory.instance.objectNode();
        index.put("generated_utc", manifest.generatedUtc());
        index.put("total_records", manifest.totalRecords());
        ArrayNode files = index.putArray("files");
        manifest.parts().forEach(part -> files.add(part.path()));
        ArrayNode years = index.putArray("years");
        if (manifest.years() != null) {
            manifest.years().forEach(years::add);
        }
        index.put("manifest", "records_manifest.json");
        return index;
    }

    private void removeStaleParts(Path dir, ExportManifest manifest) throws IOException {
        Set<String> current = new HashSet<>();
        manifest.parts().forEach(part -> current.add(part.path()));
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, settings.recordsPrefix() + "_part*.json")) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (ChunkedExporter.isPartFile(settings.recordsPrefix(), name) && !current.contains(name)) {
                    Files.delete(file);
                    log.debug("Removed stale export part {}", name);
                }
            }
        }
    }

    private static void writeCacheCopy(ICacheStore cache, String namespace, Path target) throws IOException {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, JsonNode> entry : cache.snapshot(namespace).entrySet()) {
            root.set(entry.getKey(), entry.getValue());
        }
        AtomicFiles.write(target, JsonMapper.pretty().writeValueAsBytes(root));
    }

    /**
     * Compact view of a record for the latest-items snapshot.
     */
    static ObjectNode summaryItem(EnrichedRecord record) {
        ObjectNode item = JsonNodeFactory.instance.objectNode();
        String accession = record.projectId().value();
        JsonNode project = record.projectMetadata();
        item.put("raw_id", record.raw().id());
        item.put("title", record.raw().title());
        item.put("assay", record.classification().category().label());
        item.put("country", record.geo().country());
        item.put("city", record.geo().city());
        item.put("project_accession", accession);
        item.put("project_title", project == null ? "" : project.path("title").asText(""));
        String url = project == null ? "" : project.path("ncbi").path("bioproject_url").asText("");
        item.put("url", url.isEmpty() ? PROJECT_URL + accession : url);
        item.put("ingested_utc", record.provenance().ingestedUtc());
        return item;
    }
}
