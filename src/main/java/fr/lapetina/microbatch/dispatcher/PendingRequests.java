package fr.lapetina.microbatch.dispatcher;

import fr.lapetina.microbatch.domain.model.ClassificationResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Completion handles for requests that are waiting for a response, keyed by request id.
 *
 * A handle is registered before its request is enqueued and removed when the
 * caller is done with it, whether by response, timeout or shutdown. A response
 * whose id has no handle is an orphan.
 */
public final class PendingRequests {

    private static final Logger log = LoggerFactory.getLogger(PendingRequests.class);

    private final Map<Long, CompletableFuture<ClassificationResponse>> pending = new ConcurrentHashMap<>();

    /**
     * Registers a handle for a new request id.
     *
     * @throws IllegalStateException if the id is already pending
     */
    public CompletableFuture<ClassificationResponse> register(long requestId) {
        CompletableFuture<ClassificationResponse> future = new CompletableFuture<>();
        if (pending.putIfAbsent(requestId, future) != null) {
            throw new IllegalStateException("Duplicate pending request id: " + requestId);
        }
        return future;
    }

    /**
     * Delivers a response to its waiting caller.
     *
     * @return true if a caller was waiting, false if the response is an orphan
     */
    public boolean complete(ClassificationResponse response) {
        CompletableFuture<ClassificationResponse> future = pending.remove(response.requestId());
        if (future == null) {
            return false;
        }
        return future.complete(response);
    }

    /**
     * Fails the handle for one request, if it is still pending.
     */
    public boolean fail(long requestId, Throwable cause) {
        CompletableFuture<ClassificationResponse> future = pending.remove(requestId);
        return future != null && future.completeExceptionally(cause);
    }

    public void remove(long requestId) {
        pending.remove(requestId);
    }

    public boolean isPending(long requestId) {
        return pending.containsKey(requestId);
    }

    public int size() {
        return pending.size();
    }

    /**
     * Fails every pending handle. Used on shutdown.
     *
     * @return number of handles failed
     */
    public int failAll(Throwable cause) {
        int failed = 0;
        for (Long requestId : pending.keySet()) {
            if (fail(requestId, cause)) {
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("Failed pending requests: count={}, reason={}", failed, cause.getMessage());
        }
        return failed;
    }
}
