package fr.lapetina.microbatch.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of classifying one request, produced by the worker that handled it.
 * Carries either a prediction or an error, never both.
 * Immutable and thread-safe.
 */
public record ClassificationResponse(
        long requestId,
        ClassLabel label,
        double confidence,
        int workerId,
        Instant createdAt,
        Instant completedAt,
        ErrorType errorType,
        String errorMessage
) {
    public ClassificationResponse {
        if (completedAt == null) {
            completedAt = Instant.now();
        }
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isError() {
        return errorType != null;
    }

    /**
     * Time from request creation until the response was produced.
     */
    public Duration processingTime() {
        if (createdAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(createdAt, completedAt);
    }

    /**
     * Creates a successful response.
     */
    public static ClassificationResponse success(
            ClassificationRequest request,
            Prediction prediction,
            int workerId
    ) {
        return new ClassificationResponse(
                request.requestId(),
                prediction.label(),
                prediction.confidence(),
                workerId,
                request.createdAt(),
                Instant.now(),
                null,
                null
        );
    }

    /**
     * Creates an error response.
     */
    public static ClassificationResponse error(
            ClassificationRequest request,
            ErrorType errorType,
            String errorMessage,
            int workerId
    ) {
        return new ClassificationResponse(
                request.requestId(),
                null,
                0.0,
                workerId,
                request.createdAt(),
                Instant.now(),
                errorType,
                errorMessage
        );
    }
}
