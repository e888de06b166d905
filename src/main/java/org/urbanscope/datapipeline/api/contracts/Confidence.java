package org.urbanscope.datapipeline.api.contracts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Confidence {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Confidence fromLabel(String label) {
        return valueOf(label.toUpperCase(Locale.ROOT));
    }
}
