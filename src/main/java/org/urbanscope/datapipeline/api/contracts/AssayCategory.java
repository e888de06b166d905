package org.urbanscope.datapipeline.api.contracts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of assay labels the heuristic classifier can emit.
 */
public enum AssayCategory {
    AMPLICON("Amplicon"),
    SIXTEEN_S("16S"),
    ITS("ITS"),
    RNA_SEQ("RNA-seq"),
    WGS("WGS"),
    UNKNOWN("Unknown");

    private final String label;

    AssayCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AssayCategory fromLabel(String label) {
        for (AssayCategory category : values()) {
            if (category.label.equals(label)) {
                return category;
            }
        }
        return UNKNOWN;
    }
}
