package io.github.flameyossnowy.filetx.api;

/**
 * The steps of a commit, in the order they run. The compensating phases only run
 * after one of the apply phases failed.
 */
public enum CommitPhase {
    /**
     * Writing every pending create to the backend, in staging order.
     */
    APPLY_CREATES,

    /**
     * Deleting every pending delete from the backend, in staging order.
     */
    APPLY_DELETES,

    /**
     * Rollback: deleting creates that reached the backend.
     */
    COMPENSATE_CREATES,

    /**
     * Rollback: re-writing deletes that reached the backend with their captured content.
     */
    COMPENSATE_DELETES
}
