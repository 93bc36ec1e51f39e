package fr.lapetina.microbatch.worker;

import fr.lapetina.microbatch.domain.model.ClassificationRequest;
import fr.lapetina.microbatch.domain.model.WorkerHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One worker slot in the pool.
 *
 * The id and core assignment are fixed for the life of the pool; the thread
 * behind the slot is replaced when the supervisor restarts a dead worker.
 * Thread-safe for concurrent access from the worker, the supervisor and the HTTP layer.
 */
public final class WorkerHandle {

    private static final Logger log = LoggerFactory.getLogger(WorkerHandle.class);

    private final int id;
    private final int coreAffinity;
    private final BlockingQueue<ClassificationRequest> queue;

    // Mutable state - thread-safe
    private final AtomicReference<WorkerHealth> health = new AtomicReference<>(WorkerHealth.STARTING);
    private final AtomicInteger restarts = new AtomicInteger(0);
    private final AtomicLong batchesProcessed = new AtomicLong(0);
    private final AtomicLong requestsProcessed = new AtomicLong(0);
    private volatile long lastHeartbeatNanos = System.nanoTime();
    private volatile Instant startedAt;
    private volatile Thread thread;
    private volatile BatchingWorker worker;

    public WorkerHandle(int id, int coreAffinity, BlockingQueue<ClassificationRequest> queue) {
        this.id = id;
        this.coreAffinity = coreAffinity;
        this.queue = queue;
    }

    /**
     * Starts a fresh thread running the given worker loop.
     */
    synchronized void launch(BatchingWorker newWorker) {
        if (thread != null && thread.isAlive()) {
            throw new IllegalStateException("Worker " + id + " is still running");
        }
        health.set(WorkerHealth.STARTING);
        heartbeat();
        worker = newWorker;
        startedAt = Instant.now();
        Thread t = new Thread(newWorker, "batch-worker-" + id);
        t.setDaemon(true);
        t.setUncaughtExceptionHandler((failed, ex) -> {
            log.error("Worker thread died: workerId={}, thread={}, error={}", id, failed.getName(), ex.getMessage(), ex);
            health.set(WorkerHealth.DOWN);
        });
        thread = t;
        t.start();
    }

    /**
     * Asks the worker to finish its current batch and exit, then waits for it.
     * Falls back to interrupting the thread if it does not exit in time.
     */
    synchronized void stop(Duration timeout) {
        BatchingWorker current = worker;
        Thread t = thread;
        if (current != null) {
            current.requestStop();
        }
        if (t != null) {
            try {
                t.join(timeout.toMillis());
                if (t.isAlive()) {
                    log.warn("Worker did not stop in time, interrupting: workerId={}, timeout={}", id, timeout);
                    t.interrupt();
                    t.join(timeout.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        health.set(WorkerHealth.STOPPED);
    }

    public int getId() {
        return id;
    }

    public int getCoreAffinity() {
        return coreAffinity;
    }

    public BlockingQueue<ClassificationRequest> getQueue() {
        return queue;
    }

    public int getQueueDepth() {
        return queue.size();
    }

    public WorkerHealth getHealth() {
        return health.get();
    }

    /**
     * @return the previous health
     */
    public WorkerHealth setHealth(WorkerHealth newHealth) {
        return health.getAndSet(newHealth);
    }

    /**
     * True unless the worker is down or stopped.
     */
    public boolean isAcceptingWork() {
        WorkerHealth current = health.get();
        return current != WorkerHealth.DOWN && current != WorkerHealth.STOPPED;
    }

    public boolean isAlive() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    void heartbeat() {
        lastHeartbeatNanos = System.nanoTime();
    }

    public Duration getHeartbeatAge() {
        return Duration.ofNanos(System.nanoTime() - lastHeartbeatNanos);
    }

    void recordBatch(int size) {
        batchesProcessed.incrementAndGet();
        requestsProcessed.addAndGet(size);
    }

    public long getBatchesProcessed() {
        return batchesProcessed.get();
    }

    public long getRequestsProcessed() {
        return requestsProcessed.get();
    }

    int incrementRestarts() {
        return restarts.incrementAndGet();
    }

    public int getRestarts() {
        return restarts.get();
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    @Override
    public String toString() {
        return "WorkerHandle{" +
                "id=" + id +
                ", core=" + coreAffinity +
                ", health=" + health.get() +
                ", alive=" + isAlive() +
                ", restarts=" + restarts.get() +
                ", queueDepth=" + queue.size() +
                '}';
    }
}
