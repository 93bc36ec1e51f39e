package fr.lapetina.microbatch.domain.model;

/**
 * Error taxonomy for classification requests.
 * Provides clear categorization for error handling and metrics.
 */
public enum ErrorType {
    /** Predictor failed for the whole batch the request belonged to */
    INFERENCE_ERROR,

    /** No response arrived within the wait budget */
    TIMEOUT,

    /** Request payload rejected before enqueue */
    VALIDATION_ERROR,

    /** Request queue full, request not accepted */
    CAPACITY_ERROR,

    /** Internal system error */
    INTERNAL_ERROR
}
