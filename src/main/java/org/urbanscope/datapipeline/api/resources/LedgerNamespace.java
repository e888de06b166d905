package org.urbanscope.datapipeline.api.resources;

/**
 * The two persisted dedup sets.
 */
public enum LedgerNamespace {
    /** Source-assigned raw record ids already processed. */
    RAW("seen_raw_ids.txt"),
    /** Canonical project ids already present in the corpus. */
    PROJECT("seen_projects.txt");

    private final String fileName;

    LedgerNamespace(String fileName) {
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }
}
