package fr.lapetina.microbatch.dispatcher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class RequestIdGeneratorTest {

    @Test
    @DisplayName("should use the clock when it moves forward")
    void shouldFollowClock() {
        AtomicLong clock = new AtomicLong(1_000);
        RequestIdGenerator generator = new RequestIdGenerator(clock::get);

        assertThat(generator.next()).isEqualTo(1_000);
        clock.set(5_000);
        assertThat(generator.next()).isEqualTo(5_000);
    }

    @Test
    @DisplayName("should stay strictly increasing within the same microsecond")
    void shouldNotCollideOnSameTick() {
        RequestIdGenerator generator = new RequestIdGenerator(() -> 42L);

        assertThat(generator.next()).isEqualTo(42L);
        assertThat(generator.next()).isEqualTo(43L);
        assertThat(generator.next()).isEqualTo(44L);
    }

    @Test
    @DisplayName("should stay strictly increasing when the clock steps back")
    void shouldSurviveClockStepBack() {
        AtomicLong clock = new AtomicLong(10_000);
        RequestIdGenerator generator = new RequestIdGenerator(clock::get);

        long first = generator.next();
        clock.set(9_000);

        assertThat(generator.next()).isGreaterThan(first);
    }

    @Test
    @DisplayName("should issue unique ids under concurrency")
    void shouldBeUniqueUnderConcurrency() throws Exception {
        RequestIdGenerator generator = new RequestIdGenerator();
        Set<Long> ids = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(8);

        for (int i = 0; i < 8; i++) {
            executor.submit(() -> {
                for (int j = 0; j < 1_000; j++) {
                    ids.add(generator.next());
                }
            });
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(ids).hasSize(8_000);
    }
}
