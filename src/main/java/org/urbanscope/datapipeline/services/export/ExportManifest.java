package org.urbanscope.datapipeline.services.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Describes a chunked export. Consumers read this first to find the part files.
 *
 * @param generatedUtc ISO-8601 UTC time of the export
 * @param totalRecords records over all parts
 * @param parts        part files in record order
 * @param years        periods present in the corpus, ascending; {@code null} when not known
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExportManifest(
    @JsonProperty("generated_utc") String generatedUtc,
    @JsonProperty("total_records") long totalRecords,
    @JsonProperty("parts") List<Part> parts,
    @JsonProperty("years") List<Integer> years
) {

    public ExportManifest {
        parts = List.copyOf(parts);
        years = years == null ? null : List.copyOf(years);
    }

    /**
     * @param path    part file name, relative to the manifest
     * @param records records in the part
     * @param bytes   size of the part file
     */
    public record Part(
        @JsonProperty("path") String path,
        @JsonProperty("records") long records,
        @JsonProperty("bytes") long bytes
    ) {
    }

    public ExportManifest withYears(List<Integer> periods) {
        return new ExportManifest(generatedUtc, totalRecords, parts, periods);
    }
}
