package org.urbanscope.datapipeline.services.classifier;

import org.urbanscope.datapipeline.api.contracts.GeoGuess;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Best-effort location from sample attributes. Pure, never throws on odd input.
 * <p>
 * Location strings come in two shapes and are read differently:
 * <ul>
 *   <li>{@code "Country: Region, City"}: left of the first colon is the country; after it,
 *       the last comma segment is the city and the one before it the region.</li>
 *   <li>{@code "City, Region, Country"}: the first segment is the city, the last the country and
 *       the one before the last the region. A single segment is taken as a country.</li>
 * </ul>
 * Country names go through a small alias table; unknown names are title-cased. Without a
 * country, the fallback texts are scanned for alias keywords.
 */
public class GeoInference {

    static final List<String> LOCATION_KEYS = List.of(
        "geo_loc_name", "geographic location", "geographic_location", "country", "location");
    static final List<String> LAT_LON_KEYS = List.of(
        "lat_lon", "latitude and longitude", "latitude_longitude");

    private static final Pattern LAT_LON = Pattern.compile("(-?\\d+(?:\\.\\d+)?)\\s*[, ]\\s*(-?\\d+(?:\\.\\d+)?)");

    /** Alias keys are normalized text. Order matters for the fallback scan. */
    private static final Map<String, String> COUNTRY_ALIASES = new LinkedHashMap<>();

    static {
        COUNTRY_ALIASES.put("usa", "United States");
        COUNTRY_ALIASES.put("u.s.a", "United States");
        COUNTRY_ALIASES.put("united states", "United States");
        COUNTRY_ALIASES.put("uk", "United Kingdom");
        COUNTRY_ALIASES.put("u.k.", "United Kingdom");
        COUNTRY_ALIASES.put("england", "United Kingdom");
        COUNTRY_ALIASES.put("scotland", "United Kingdom");
        COUNTRY_ALIASES.put("uae", "United Arab Emirates");
    }

    /**
     * Infers a location.
     *
     * @param attributes sample or record attributes, keys as reported by the source
     * @param fallbacks  free texts scanned for country keywords when no country was parsed
     */
    public GeoGuess infer(Map<String, String> attributes, List<String> fallbacks) {
        String raw = firstPresent(attributes, LOCATION_KEYS);

        String lat = "";
        String lon = "";
        String latLon = firstPresent(attributes, LAT_LON_KEYS);
        if (!latLon.isEmpty()) {
            Matcher m = LAT_LON.matcher(latLon);
            if (m.find()) {
                lat = m.group(1);
                lon = m.group(2);
            }
        }

        String country = "";
        String region = "";
        String city = "";
        if (!raw.isEmpty()) {
            int colon = raw.indexOf(':');
            if (colon >= 0) {
                country = raw.substring(0, colon).trim();
                List<String> bits = commaSegments(raw.substring(colon + 1));
                if (!bits.isEmpty()) {
                    city = bits.get(bits.size() - 1);
                    if (bits.size() >= 2) {
                        region = bits.get(bits.size() - 2);
                    }
                }
            } else {
                List<String> bits = commaSegments(raw);
                if (bits.size() == 1) {
                    country = bits.get(0);
                } else if (bits.size() >= 2) {
                    city = bits.get(0);
                    country = bits.get(bits.size() - 1);
                    if (bits.size() >= 3) {
                        region = bits.get(bits.size() - 2);
                    }
                }
            }
        }

        country = canonicalCountry(country);
        if (country.isEmpty() && fallbacks != null) {
            country = scanFallbacks(fallbacks);
        }
        return new GeoGuess(country, region, city, lat, lon, raw);
    }

    static String canonicalCountry(String country) {
        if (country.isEmpty()) {
            return "";
        }
        String alias = COUNTRY_ALIASES.get(TextNormalizer.normalize(country));
        if (alias != null) {
            return alias;
        }
        return titleCase(country);
    }

    private static String scanFallbacks(List<String> fallbacks) {
        String blob = TextNormalizer.normalize(fallbacks.stream()
            .filter(Objects::nonNull)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.joining(" | ")));
        if (blob.isEmpty()) {
            return "";
        }
        for (Map.Entry<String, String> alias : COUNTRY_ALIASES.entrySet()) {
            if (blob.contains(alias.getKey())) {
                return alias.getValue();
            }
        }
        return "";
    }

    private static String firstPresent(Map<String, String> attributes, List<String> keys) {
        if (attributes == null) {
            return "";
        }
        for (String key : keys) {
            String value = attributes.get(key);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return "";
    }

    private static List<String> commaSegments(String s) {
        List<String> bits = new ArrayList<>();
        for (String bit : s.split(",")) {
            String trimmed = bit.trim();
            if (!trimmed.isEmpty()) {
                bits.add(trimmed);
            }
        }
        return bits;
    }

    private static String titleCase(String s) {
        StringBuilder out = new StringBuilder();
        for (String word : s.trim().split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
                .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return out.toString();
    }
}
