package fr.lapetina.microbatch.worker;

import fr.lapetina.microbatch.domain.model.FlushTrigger;

import java.time.Duration;
import java.util.Optional;

/**
 * Decides when a worker closes its batch.
 *
 * A batch flushes when it holds {@code maxBatchSize} members, or when it is
 * non-empty and its first member has waited longer than {@code maxBatchAge}.
 */
public final class BatchPolicy {

    private final int maxBatchSize;
    private final long maxBatchAgeNanos;

    public BatchPolicy(int maxBatchSize, Duration maxBatchAge) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be >= 1");
        }
        if (maxBatchAge.isNegative()) {
            throw new IllegalArgumentException("maxBatchAge must not be negative");
        }
        this.maxBatchSize = maxBatchSize;
        this.maxBatchAgeNanos = maxBatchAge.toNanos();
    }

    /**
     * @param size     Current batch size
     * @param ageNanos Time since the first member arrived
     * @return The trigger if the batch must flush now
     */
    public Optional<FlushTrigger> shouldFlush(int size, long ageNanos) {
        if (size >= maxBatchSize) {
            return Optional.of(FlushTrigger.SIZE);
        }
        if (size > 0 && ageNanos > maxBatchAgeNanos) {
            return Optional.of(FlushTrigger.AGE);
        }
        return Optional.empty();
    }

    /**
     * Time left before a batch of the given age expires, never negative.
     */
    public long remainingNanos(long ageNanos) {
        return Math.max(0, maxBatchAgeNanos - ageNanos);
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public Duration getMaxBatchAge() {
        return Duration.ofNanos(maxBatchAgeNanos);
    }
}
