package fr.lapetina.microbatch.domain.model;

/**
 * Reason a worker closed its batch and sent it to the predictor.
 */
public enum FlushTrigger {
    /** Batch reached the maximum size */
    SIZE,

    /** Oldest member waited longer than the maximum batch age */
    AGE,

    /** Worker is stopping and drains what it holds */
    SHUTDOWN
}
