package fr.lapetina.microbatch.domain.event;

import fr.lapetina.microbatch.domain.model.ClassificationResponse;

import java.time.Instant;

/**
 * Event object for the response ring buffer.
 *
 * Mutable holder reused across the ring buffer. Workers fill it when
 * publishing; each handler stage updates it as it progresses.
 * It should never be accessed outside the Disruptor pipeline handlers.
 */
public final class ResponseEvent {

    private ClassificationResponse response;
    private EventState state;
    private Instant publishedAt;
    private Instant correlatedAt;
    private long sequence;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.response = null;
        this.state = null;
        this.publishedAt = null;
        this.correlatedAt = null;
        this.sequence = -1;
    }

    /**
     * Initializes the event with a freshly produced response.
     */
    public void initialize(ClassificationResponse response) {
        clear();
        this.response = response;
        this.state = EventState.PUBLISHED;
        this.publishedAt = Instant.now();
    }

    public ClassificationResponse getResponse() {
        return response;
    }

    public EventState getState() {
        return state;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    public Instant getCorrelatedAt() {
        return correlatedAt;
    }

    public void setSequence(long sequence) {
        this.sequence = sequence;
    }

    public void markCorrelated() {
        this.state = EventState.CORRELATED;
        this.correlatedAt = Instant.now();
    }

    public void markOrphaned() {
        this.state = EventState.ORPHANED;
    }

    @Override
    public String toString() {
        return "ResponseEvent{" +
                "requestId=" + (response != null ? response.requestId() : "null") +
                ", workerId=" + (response != null ? response.workerId() : "null") +
                ", state=" + state +
                ", seq=" + sequence +
                '}';
    }
}
