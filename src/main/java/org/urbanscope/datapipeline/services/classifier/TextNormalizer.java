package org.urbanscope.datapipeline.services.classifier;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lower-cases, trims and collapses whitespace. Every marker comparison in this package runs on
 * normalized text.
 */
final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    static String normalize(String s) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        return WHITESPACE.matcher(s.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }
}
