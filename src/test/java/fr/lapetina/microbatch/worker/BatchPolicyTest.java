package fr.lapetina.microbatch.worker;

import fr.lapetina.microbatch.domain.model.FlushTrigger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchPolicyTest {

    private static final long MS = 1_000_000L;

    private final BatchPolicy policy = new BatchPolicy(32, Duration.ofMillis(100));

    @Test
    @DisplayName("should flush a full batch regardless of age")
    void shouldFlushOnSize() {
        assertThat(policy.shouldFlush(32, 0)).contains(FlushTrigger.SIZE);
    }

    @Test
    @DisplayName("should flush a non-empty batch once older than the maximum age")
    void shouldFlushOnAge() {
        assertThat(policy.shouldFlush(1, 100 * MS)).isEmpty();
        assertThat(policy.shouldFlush(1, 100 * MS + 1)).contains(FlushTrigger.AGE);
    }

    @Test
    @DisplayName("should never flush an empty batch")
    void shouldNotFlushEmptyBatch() {
        assertThat(policy.shouldFlush(0, 10_000 * MS)).isEmpty();
    }

    @Test
    @DisplayName("should report remaining time before expiry")
    void shouldReportRemaining() {
        assertThat(policy.remainingNanos(30 * MS)).isEqualTo(70 * MS);
        assertThat(policy.remainingNanos(500 * MS)).isZero();
    }

    @Test
    @DisplayName("should reject a batch size below one")
    void shouldRejectInvalidSize() {
        assertThatThrownBy(() -> new BatchPolicy(0, Duration.ofMillis(100)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
