package org.urbanscope.datapipeline.api.contracts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Best-effort location. Every field is independently optional; absent values are empty strings.
 * Latitude and longitude are kept as the numeric tokens found in the source text.
 */
public record GeoGuess(
    @JsonProperty("country") String country,
    @JsonProperty("region") String region,
    @JsonProperty("city") String city,
    @JsonProperty("lat") String latitude,
    @JsonProperty("lon") String longitude,
    @JsonProperty("raw") String raw
) {

    private static final GeoGuess EMPTY = new GeoGuess("", "", "", "", "", "");

    @JsonCreator
    public GeoGuess {
        country = nullToEmpty(country);
        region = nullToEmpty(region);
        city = nullToEmpty(city);
        latitude = nullToEmpty(latitude);
        longitude = nullToEmpty(longitude);
        raw = nullToEmpty(raw);
    }

    public static GeoGuess empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return country.isEmpty() && region.isEmpty() && city.isEmpty()
            && latitude.isEmpty() && longitude.isEmpty() && raw.isEmpty();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
