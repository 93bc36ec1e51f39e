package fr.lapetina.microbatch.dispatcher;

import fr.lapetina.microbatch.dispatcher.exception.BackpressureException;
import fr.lapetina.microbatch.dispatcher.exception.RequestTimeoutException;
import fr.lapetina.microbatch.dispatcher.exception.ValidationException;
import fr.lapetina.microbatch.domain.model.ClassificationRequest;
import fr.lapetina.microbatch.domain.model.ClassificationResponse;
import fr.lapetina.microbatch.domain.model.ErrorType;
import fr.lapetina.microbatch.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Front door for classification requests.
 *
 * <p>Assigns each payload a request id, registers a completion handle, places
 * the request on a worker queue and waits at most the request timeout for the
 * matching response. Callers never see each other's responses: a response is
 * delivered only through the handle registered under its own id.</p>
 *
 * <p>Thread-safe; called concurrently from every HTTP handler thread.</p>
 */
public final class Dispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final RequestRouter router;
    private final PendingRequests pending;
    private final RequestIdGenerator idGenerator;
    private final Duration requestTimeout;
    private final int maxPayloadLength;
    private final MetricsRegistry metrics;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public Dispatcher(
            RequestRouter router,
            PendingRequests pending,
            RequestIdGenerator idGenerator,
            Duration requestTimeout,
            int maxPayloadLength,
            MetricsRegistry metrics
    ) {
        this.router = router;
        this.pending = pending;
        this.idGenerator = idGenerator;
        this.requestTimeout = requestTimeout;
        this.maxPayloadLength = maxPayloadLength;
        this.metrics = metrics;
    }

    /**
     * Submits a payload for classification.
     *
     * <p>The returned future completes with the worker's response, or
     * exceptionally with a {@link TimeoutException} once the request timeout
     * elapses, or with an {@link IllegalStateException} if the dispatcher shuts down.</p>
     *
     * @throws ValidationException   if the payload is blank or too long
     * @throws BackpressureException if the request queue cannot take the request
     */
    public CompletableFuture<ClassificationResponse> submit(String payload) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Dispatcher is shut down"));
        }
        return enqueue(newRequest(payload));
    }

    /**
     * Classifies a payload, blocking the calling thread until the response
     * arrives or the request timeout elapses.
     *
     * @return the worker's response, which may carry an inference error
     * @throws RequestTimeoutException if no response arrived in time
     * @throws ValidationException     if the payload is blank or too long
     * @throws BackpressureException   if the request queue cannot take the request
     */
    public ClassificationResponse classify(String payload) {
        if (closed.get()) {
            throw new IllegalStateException("Dispatcher is shut down");
        }
        ClassificationRequest request = newRequest(payload);
        CompletableFuture<ClassificationResponse> future = enqueue(request);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for classification", e);
        } catch (ExecutionException e) {
            throw unwrap(request.requestId(), e.getCause());
        }
    }

    private ClassificationRequest newRequest(String payload) {
        validate(payload);
        return new ClassificationRequest(idGenerator.next(), payload, Instant.now());
    }

    private CompletableFuture<ClassificationResponse> enqueue(ClassificationRequest request) {
        long requestId = request.requestId();

        // Register before enqueueing so even an immediate response finds its caller
        CompletableFuture<ClassificationResponse> future = pending.register(requestId);
        try {
            router.route(request);
        } catch (BackpressureException e) {
            pending.remove(requestId);
            metrics.incrementRequestCount(ErrorType.CAPACITY_ERROR);
            log.warn("Request rejected: requestId={}, reason={}", requestId, e.getReason());
            throw e;
        } catch (RuntimeException e) {
            pending.remove(requestId);
            metrics.incrementRequestCount(ErrorType.INTERNAL_ERROR);
            log.error("Request routing failed: requestId={}, error={}", requestId, e.getMessage(), e);
            throw e;
        }

        log.debug("Request submitted: requestId={}, payloadLength={}", requestId, request.payload().length());

        // Callers observe the dependent stage, so the handle is gone by the time they wake up
        return future
                .orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((response, ex) -> {
                    pending.remove(requestId);
                    recordOutcome(request, response, ex);
                });
    }

    private RuntimeException unwrap(long requestId, Throwable cause) {
        if (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return new RequestTimeoutException(requestId, requestTimeout);
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException(cause.getMessage(), cause);
    }

    private void validate(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new ValidationException("Payload is required");
        }
        if (payload.length() > maxPayloadLength) {
            throw new ValidationException(
                    "Payload exceeds maximum length: " + payload.length() + " > " + maxPayloadLength);
        }
    }

    private void recordOutcome(ClassificationRequest request, ClassificationResponse response, Throwable ex) {
        metrics.recordRequestLatency(Duration.between(request.createdAt(), Instant.now()));
        if (ex instanceof CompletionException && ex.getCause() != null) {
            ex = ex.getCause();
        }
        if (ex instanceof TimeoutException) {
            metrics.incrementRequestCount(ErrorType.TIMEOUT);
            log.warn("Request timed out: requestId={}, timeout={}", request.requestId(), requestTimeout);
        } else if (ex != null) {
            metrics.incrementRequestCount(ErrorType.INTERNAL_ERROR);
        } else {
            metrics.incrementRequestCount(response.errorType());
        }
    }

    public int getPendingCount() {
        return pending.size();
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public String getRouting() {
        return router.getRouting();
    }

    /**
     * Stops accepting requests and fails every caller still waiting.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            int failed = pending.failAll(new IllegalStateException("Dispatcher is shut down"));
            log.info("Dispatcher closed: failedPending={}", failed);
        }
    }
}
