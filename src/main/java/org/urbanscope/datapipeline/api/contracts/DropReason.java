package org.urbanscope.datapipeline.api.contracts;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reason codes for records that do not enter the corpus.
 */
public enum DropReason {
    UNRESOLVED("unresolved"),
    DUPLICATE_PERSISTED("duplicate-persisted"),
    DUPLICATE_IN_BATCH("duplicate-in-batch"),
    FETCH_ERROR("fetch_error");

    private final String code;

    DropReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
