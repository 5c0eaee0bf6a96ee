package org.ipod.datapipeline.services;

/**
 * Lifecycle states of one orchestration run.
 */
public enum RunState {
    /** No run started, or the previous run has been reset. */
    EMPTY,
    /** Inputs materialized and broadcast, chunks being planned. */
    PLANNING,
    /** Chunk tasks being submitted or executed. */
    DISPATCHING,
    /** A completed chunk being merged into the running totals. */
    MERGING,
    /** All chunks merged. Terminal. */
    DONE,
    /** A chunk failed. Terminal. */
    ABORTED;

    public boolean isTerminal() {
        return this == DONE || this == ABORTED;
    }
}
