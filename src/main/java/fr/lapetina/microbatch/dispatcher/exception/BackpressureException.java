package fr.lapetina.microbatch.dispatcher.exception;

/**
 * Exception thrown when a request cannot be accepted right now.
 *
 * This occurs when:
 * - The request queue is full
 * - No worker is accepting work under directed routing
 */
public final class BackpressureException extends RuntimeException {

    private final BackpressureReason reason;

    public BackpressureException(BackpressureReason reason) {
        super("Backpressure: " + reason.getMessage());
        this.reason = reason;
    }

    public BackpressureException(BackpressureReason reason, String details) {
        super("Backpressure: " + reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public enum BackpressureReason {
        REQUEST_QUEUE_FULL("Request queue is full"),
        NO_AVAILABLE_WORKER("No worker is accepting requests");

        private final String message;

        BackpressureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
