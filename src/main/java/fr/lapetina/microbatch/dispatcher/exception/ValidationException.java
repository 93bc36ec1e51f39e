package fr.lapetina.microbatch.dispatcher.exception;

/**
 * Thrown when a payload is rejected before it reaches a worker.
 */
public final class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
