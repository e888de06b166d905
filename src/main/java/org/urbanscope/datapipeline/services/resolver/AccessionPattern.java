package org.urbanscope.datapipeline.services.resolver;

import org.urbanscope.datapipeline.api.contracts.CanonicalProjectId;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds project accessions inside free text.
 * <p>
 * Matching is case-insensitive and bounded by word boundaries. Each hit is re-validated through
 * {@link CanonicalProjectId#parse(String)} before it is returned.
 */
public final class AccessionPattern {

    private static final Pattern IN_TEXT = Pattern.compile("\\bPRJ(?:NA|EB|DB)\\d+\\b", Pattern.CASE_INSENSITIVE);

    private AccessionPattern() {
    }

    /**
     * Returns the first valid accession in {@code text}.
     */
    public static Optional<CanonicalProjectId> firstIn(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher m = IN_TEXT.matcher(text);
        while (m.find()) {
            Optional<CanonicalProjectId> id = CanonicalProjectId.parse(m.group());
            if (id.isPresent()) {
                return id;
            }
        }
        return Optional.empty();
    }
}
