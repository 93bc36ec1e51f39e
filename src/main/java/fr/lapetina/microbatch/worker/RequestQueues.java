package fr.lapetina.microbatch.worker;

import fr.lapetina.microbatch.domain.model.ClassificationRequest;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * The request queue(s) workers drain.
 *
 * In shared mode every worker polls the same bounded FIFO. In per-worker mode
 * each worker id owns its own bounded FIFO, which survives worker restarts.
 */
public final class RequestQueues {

    private final boolean shared;
    private final int capacity;
    private final BlockingQueue<ClassificationRequest> sharedQueue;
    private final ConcurrentHashMap<Integer, BlockingQueue<ClassificationRequest>> perWorker =
            new ConcurrentHashMap<>();

    private RequestQueues(boolean shared, int capacity) {
        this.shared = shared;
        this.capacity = capacity;
        this.sharedQueue = shared ? new LinkedBlockingQueue<>(capacity) : null;
    }

    public static RequestQueues shared(int capacity) {
        return new RequestQueues(true, capacity);
    }

    public static RequestQueues perWorker(int capacity) {
        return new RequestQueues(false, capacity);
    }

    /**
     * Returns the queue a worker drains.
     */
    public BlockingQueue<ClassificationRequest> queueFor(int workerId) {
        if (shared) {
            return sharedQueue;
        }
        return perWorker.computeIfAbsent(workerId, id -> new LinkedBlockingQueue<>(capacity));
    }

    public boolean isShared() {
        return shared;
    }

    /**
     * Total requests waiting across all queues.
     */
    public int totalDepth() {
        if (shared) {
            return sharedQueue.size();
        }
        int depth = 0;
        for (BlockingQueue<ClassificationRequest> queue : perWorker.values()) {
            depth += queue.size();
        }
        return depth;
    }
}
