package org.urbanscope.datapipeline.services.export;

import com.typesafe.config.Config;
import org.urbanscope.datapipeline.utils.PathExpansion;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where and how big the exported artifacts are.
 *
 * @param databaseDir    directory for part files, manifest, index and cache copies
 * @param latestFile     path of the latest-items snapshot
 * @param recordsPrefix  part file prefix
 * @param maxPartBytes   budget per part file
 * @param maxLatestBytes ceiling for the snapshot
 * @param latestItems    candidate items for the snapshot
 */
public record ExportSettings(
    Path databaseDir,
    Path latestFile,
    String recordsPrefix,
    long maxPartBytes,
    long maxLatestBytes,
    int latestItems
) {

    public ExportSettings {
        Objects.requireNonNull(databaseDir, "databaseDir cannot be null");
        Objects.requireNonNull(latestFile, "latestFile cannot be null");
        Objects.requireNonNull(recordsPrefix, "recordsPrefix cannot be null");
        if (latestItems < 0) {
            throw new IllegalArgumentException("latestItems must not be negative: " + latestItems);
        }
    }

    /**
     * Reads export settings from the root {@code urbanscope} config. Exports live under
     * {@code <docsDir>/db}, the snapshot at {@code <docsDir>/latest.json}.
     */
    public static ExportSettings fromConfig(Config urbanscope) {
        Path docsDir = PathExpansion.expandToPath(urbanscope.getString("paths.docsDir"));
        Config export = urbanscope.getConfig("export");
        return new ExportSettings(
            docsDir.resolve("db"),
            docsDir.resolve("latest.json"),
            export.getString("recordsPrefix"),
            export.getBytes("maxPartBytes"),
            export.getBytes("maxLatestBytes"),
            urbanscope.getInt("harvest.latestItems"));
    }
}
