package fr.lapetina.microbatch.domain.event;

/**
 * Lifecycle state of a response event in the Disruptor pipeline.
 */
public enum EventState {
    /** Published by a worker, awaiting correlation */
    PUBLISHED,

    /** Matched a pending request and completed its handle */
    CORRELATED,

    /** No pending request for this id (caller timed out or went away) */
    ORPHANED
}
