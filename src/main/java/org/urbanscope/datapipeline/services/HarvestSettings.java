package org.urbanscope.datapipeline.services;

import com.typesafe.config.Config;
import org.urbanscope.datapipeline.utils.PathExpansion;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Tunables of a harvest run, read from the {@code urbanscope.harvest} block.
 *
 * @param query                 catalog query
 * @param limit                 maximum raw ids per search call
 * @param fetchBioproject       enrich kept records with project metadata
 * @param fetchBiosample        enrich kept records with sample metadata
 * @param deepFallback          allow the full-text resolution tier
 * @param debug                 write per-batch report and decision log files
 * @param debugDir              directory for debug files
 * @param latestReportFile      aggregate report of the last run
 * @param flushEveryRecords     commit after this many new raw ids
 * @param reconcileLedgerOnLoad repair the ledger from the record log on startup
 * @param sourceTag             provenance source tag
 */
public record HarvestSettings(
    String query,
    int limit,
    boolean fetchBioproject,
    boolean fetchBiosample,
    boolean deepFallback,
    boolean debug,
    Path debugDir,
    Path latestReportFile,
    int flushEveryRecords,
    boolean reconcileLedgerOnLoad,
    String sourceTag
) {

    public HarvestSettings {
        Objects.requireNonNull(query, "query cannot be null");
        Objects.requireNonNull(debugDir, "debugDir cannot be null");
        Objects.requireNonNull(latestReportFile, "latestReportFile cannot be null");
        Objects.requireNonNull(sourceTag, "sourceTag cannot be null");
        if (query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (flushEveryRecords <= 0) {
            throw new IllegalArgumentException("flushEveryRecords must be positive: " + flushEveryRecords);
        }
    }

    /**
     * Reads settings from the root {@code urbanscope} config.
     */
    public static HarvestSettings fromConfig(Config urbanscope) {
        Config harvest = urbanscope.getConfig("harvest");
        Path dataDir = PathExpansion.expandToPath(urbanscope.getString("paths.dataDir"));
        Path docsDir = PathExpansion.expandToPath(urbanscope.getString("paths.docsDir"));
        return new HarvestSettings(
            harvest.getString("query"),
            harvest.getInt("limit"),
            harvest.getBoolean("fetchBioproject"),
            harvest.getBoolean("fetchBiosample"),
            harvest.getBoolean("deepFallback"),
            harvest.getBoolean("debug"),
            dataDir.resolve("debug"),
            docsDir.resolve("debug").resolve("latest_report.json"),
            harvest.getInt("flushEveryRecords"),
            harvest.getBoolean("reconcileLedgerOnLoad"),
            harvest.getString("sourceTag"));
    }

    public HarvestSettings withQuery(String newQuery) {
        return new HarvestSettings(newQuery, limit, fetchBioproject, fetchBiosample, deepFallback, debug,
            debugDir, latestReportFile, flushEveryRecords, reconcileLedgerOnLoad, sourceTag);
    }

    public HarvestSettings withLimit(int newLimit) {
        return new HarvestSettings(query, newLimit, fetchBioproject, fetchBiosample, deepFallback, debug,
            debugDir, latestReportFile, flushEveryRecords, reconcileLedgerOnLoad, sourceTag);
    }

    public HarvestSettings withFlags(boolean bioproject, boolean biosample, boolean deep, boolean debugFiles) {
        return new HarvestSettings(query, limit, bioproject, biosample, deep, debugFiles,
            debugDir, latestReportFile, flushEveryRecords, reconcileLedgerOnLoad, sourceTag);
    }
}
