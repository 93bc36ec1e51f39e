package fr.lapetina.microbatch.dispatcher;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Issues request ids derived from the wall clock in microseconds.
 *
 * Ids are strictly increasing for the life of the generator: when two calls
 * land on the same microsecond, or the clock steps back, the next id is the
 * previous one plus one.
 */
public final class RequestIdGenerator {

    private final LongSupplier clockMicros;
    private final AtomicLong last = new AtomicLong(Long.MIN_VALUE);

    public RequestIdGenerator() {
        this(RequestIdGenerator::currentMicros);
    }

    RequestIdGenerator(LongSupplier clockMicros) {
        this.clockMicros = clockMicros;
    }

    public long next() {
        long now = clockMicros.getAsLong();
        return last.updateAndGet(previous -> previous == Long.MIN_VALUE ? now : Math.max(now, previous + 1));
    }

    private static long currentMicros() {
        Instant now = Instant.now();
        return Math.addExact(Math.multiplyExact(now.getEpochSecond(), 1_000_000L), now.getNano() / 1_000L);
    }
}
