package org.urbanscope.datapipeline.api.contracts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalized project accession, the unit of deduplication.
 * <p>
 * Only values fully matching {@link #PATTERN} after trimming and upper-casing can be constructed.
 * Heuristically extracted strings must go through {@link #parse(String)}.
 */
public record CanonicalProjectId(String value) implements Comparable<CanonicalProjectId> {

    /** Fixed prefix set followed by digits, matched against the whole normalized value. */
    public static final Pattern PATTERN = Pattern.compile("PRJ(?:NA|EB|DB)\\d+");

    public CanonicalProjectId {
        Objects.requireNonNull(value, "value cannot be null");
        if (!PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("Not a canonical project accession: '" + value + "'");
        }
    }

    /**
     * Normalizes (trim, upper-case) and validates a candidate accession.
     *
     * @param raw candidate string, may be {@code null}
     * @return the canonical id, or empty if the candidate is malformed
     */
    public static Optional<CanonicalProjectId> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if (!PATTERN.matcher(normalized).matches()) {
            return Optional.empty();
        }
        return Optional.of(new CanonicalProjectId(normalized));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static CanonicalProjectId fromJson(String value) {
        return new CanonicalProjectId(value);
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public int compareTo(CanonicalProjectId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
