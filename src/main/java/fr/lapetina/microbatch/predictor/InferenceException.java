package fr.lapetina.microbatch.predictor;

/**
 * Raised by a predictor when a whole batch cannot be classified,
 * or when a predictor cannot be loaded.
 */
public class InferenceException extends Exception {

    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
