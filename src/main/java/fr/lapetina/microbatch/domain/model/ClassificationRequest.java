package fr.lapetina.microbatch.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single sentence waiting to be classified.
 * Immutable and thread-safe; consumed exactly once by exactly one worker.
 */
public record ClassificationRequest(
        long requestId,
        String payload,
        Instant createdAt
) {
    public ClassificationRequest {
        Objects.requireNonNull(payload, "Payload is required");
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static ClassificationRequest of(long requestId, String payload) {
        return new ClassificationRequest(requestId, payload, null);
    }
}
