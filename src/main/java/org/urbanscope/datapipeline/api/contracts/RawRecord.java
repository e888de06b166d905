package org.urbanscope.datapipeline.api.contracts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One unit fetched from the remote catalog (typically one sequencing run), before resolution.
 * <p>
 * Instances are immutable: the field map is defensively copied and insertion order is kept,
 * so that tier-1 resolution scans fields in the order the source reported them.
 *
 * @param id                source-assigned identifier (the raw-id ledger key)
 * @param title             free-text title, never {@code null}
 * @param fields            structured fields keyed by field name (e.g. {@code LibraryStrategy})
 * @param embeddedAccession project-like reference the source itself reported, or {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RawRecord(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("fields") Map<String, String> fields,
    @JsonProperty("embedded_accession") String embeddedAccession
) {

    @JsonCreator
    public RawRecord {
        Objects.requireNonNull(id, "id cannot be null");
        title = title == null ? "" : title;
        fields = fields == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        embeddedAccession = (embeddedAccession == null || embeddedAccession.isBlank()) ? null : embeddedAccession;
    }

    /**
     * Convenience factory for records without an embedded accession.
     */
    public static RawRecord of(String id, String title, Map<String, String> fields) {
        return new RawRecord(id, title, fields, null);
    }

    /**
     * Returns the named field, or an empty string when absent.
     *
     * @param name field name, case-sensitive
     * @return the trimmed value or {@code ""}
     */
    public String field(String name) {
        String value = fields.get(name);
        return value == null ? "" : value.trim();
    }

    /**
     * Returns the embedded accession hint if the source reported one.
     */
    public Optional<String> embeddedAccessionHint() {
        return Optional.ofNullable(embeddedAccession);
    }
}
