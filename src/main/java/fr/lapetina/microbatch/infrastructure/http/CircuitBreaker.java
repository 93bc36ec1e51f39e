package fr.lapetina.microbatch.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Circuit breaker guarding calls to a model server.
 *
 * States:
 * - CLOSED: calls pass through, consecutive failures are counted
 * - OPEN: failure threshold reached, calls fail fast until the recovery timeout elapses
 * - HALF_OPEN: probe calls allowed; enough successes close, any failure reopens
 *
 * Thread-safe via atomic operations.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final long recoveryNanos;
    private final int probeSuccessThreshold;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicInteger probeSuccesses = new AtomicInteger(0);
    private volatile long openedAtNanos;

    public CircuitBreaker(
            String name,
            int failureThreshold,
            Duration recoveryTimeout,
            int probeSuccessThreshold
    ) {
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryNanos = recoveryTimeout.toNanos();
        this.probeSuccessThreshold = probeSuccessThreshold;
    }

    /**
     * Checks whether a call may proceed, moving OPEN to HALF_OPEN once the
     * recovery timeout has elapsed.
     */
    public boolean allowRequest() {
        return getState() != State.OPEN;
    }

    public void recordSuccess() {
        switch (state.get()) {
            case CLOSED -> consecutiveFailures.set(0);
            case HALF_OPEN -> {
                if (probeSuccesses.incrementAndGet() >= probeSuccessThreshold
                        && state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
                    consecutiveFailures.set(0);
                    log.info("Circuit breaker CLOSED after recovery: name={}", name);
                }
            }
            case OPEN -> {
                // A call admitted before the breaker opened; ignore
            }
        }
    }

    public void recordFailure() {
        State current = state.get();
        if (current == State.HALF_OPEN) {
            if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                openedAtNanos = System.nanoTime();
                log.warn("Circuit breaker OPENED (probe failed): name={}", name);
            }
            return;
        }
        if (current == State.CLOSED) {
            int failures = consecutiveFailures.incrementAndGet();
            if (failures >= failureThreshold && state.compareAndSet(State.CLOSED, State.OPEN)) {
                openedAtNanos = System.nanoTime();
                log.warn("Circuit breaker OPENED: name={}, failures={}", name, failures);
            }
        }
    }

    public State getState() {
        if (state.get() == State.OPEN && System.nanoTime() - openedAtNanos >= recoveryNanos) {
            if (state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
                probeSuccesses.set(0);
                log.info("Circuit breaker transitioning to HALF_OPEN: name={}", name);
            }
        }
        return state.get();
    }

    public int getFailureCount() {
        return consecutiveFailures.get();
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "name='" + name + '\'' +
                ", state=" + state.get() +
                ", failures=" + consecutiveFailures.get() +
                '}';
    }
}
