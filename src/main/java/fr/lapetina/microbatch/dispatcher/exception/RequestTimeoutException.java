package fr.lapetina.microbatch.dispatcher.exception;

import java.time.Duration;

/**
 * Thrown to a caller whose response did not arrive within the request timeout.
 * The request may still be classified later; that response is then discarded.
 */
public final class RequestTimeoutException extends RuntimeException {

    private final long requestId;
    private final Duration timeout;

    public RequestTimeoutException(long requestId, Duration timeout) {
        super("Request timeout: requestId=" + requestId + ", timeout=" + timeout);
        this.requestId = requestId;
        this.timeout = timeout;
    }

    public long getRequestId() {
        return requestId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
