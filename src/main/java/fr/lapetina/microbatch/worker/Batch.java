package fr.lapetina.microbatch.worker;

import fr.lapetina.microbatch.domain.model.ClassificationRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * Ordered requests held by one worker between flushes.
 * Not thread-safe; lives inside a single worker loop.
 */
final class Batch {

    private final int capacity;
    private final List<ClassificationRequest> members;
    private long openedAtNanos;

    Batch(int capacity) {
        this.capacity = capacity;
        this.members = new ArrayList<>(capacity);
    }

    void add(ClassificationRequest request, long nowNanos) {
        if (members.size() >= capacity) {
            throw new IllegalStateException("Batch is full: " + capacity);
        }
        if (members.isEmpty()) {
            openedAtNanos = nowNanos;
        }
        members.add(request);
    }

    /**
     * Moves already-queued requests into the batch without blocking, up to capacity.
     *
     * @return number of requests moved
     */
    int drainFrom(BlockingQueue<ClassificationRequest> queue, long nowNanos) {
        int room = capacity - members.size();
        if (room <= 0) {
            return 0;
        }
        if (members.isEmpty()) {
            openedAtNanos = nowNanos;
        }
        return queue.drainTo(members, room);
    }

    long ageNanos(long nowNanos) {
        return members.isEmpty() ? 0 : nowNanos - openedAtNanos;
    }

    int size() {
        return members.size();
    }

    boolean isEmpty() {
        return members.isEmpty();
    }

    /**
     * Returns the members in arrival order and empties the batch.
     */
    List<ClassificationRequest> takeAll() {
        List<ClassificationRequest> taken = List.copyOf(members);
        members.clear();
        return taken;
    }
}
