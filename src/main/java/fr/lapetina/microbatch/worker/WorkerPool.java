package fr.lapetina.microbatch.worker;

import fr.lapetina.microbatch.domain.model.ClassificationRequest;
import fr.lapetina.microbatch.domain.model.ClassificationResponse;
import fr.lapetina.microbatch.domain.model.ErrorType;
import fr.lapetina.microbatch.domain.model.WorkerHealth;
import fr.lapetina.microbatch.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.microbatch.predictor.PredictorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed-size pool of batching workers.
 *
 * Each worker gets a stable id, a core assignment and its own predictor
 * instance. Workers share nothing mutable except the request queue(s) and
 * the response sink.
 */
public final class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final int workerCount;
    private final RequestQueues queues;
    private final PredictorFactory predictorFactory;
    private final ResponseSink sink;
    private final BatchPolicy policy;
    private final Duration pollInterval;
    private final Duration stopTimeout;
    private final boolean pinCores;
    private final MetricsRegistry metrics;
    private final List<WorkerHandle> workers;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private WorkerPool(Builder builder) {
        if (builder.workerCount < 1 || builder.workerCount > builder.maxWorkers) {
            throw new IllegalArgumentException(
                    "Worker count must be between 1 and " + builder.maxWorkers + ": " + builder.workerCount);
        }
        this.workerCount = builder.workerCount;
        this.queues = Objects.requireNonNull(builder.queues, "Request queues are required");
        this.predictorFactory = Objects.requireNonNull(builder.predictorFactory, "Predictor factory is required");
        this.sink = Objects.requireNonNull(builder.sink, "Response sink is required");
        this.policy = Objects.requireNonNull(builder.policy, "Batch policy is required");
        this.pollInterval = builder.pollInterval;
        this.stopTimeout = builder.stopTimeout;
        this.pinCores = builder.pinCores;
        this.metrics = Objects.requireNonNull(builder.metrics, "Metrics registry is required");

        int processors = Runtime.getRuntime().availableProcessors();
        List<WorkerHandle> handles = new ArrayList<>(workerCount);
        for (int id = 0; id < workerCount; id++) {
            handles.add(new WorkerHandle(id, id % processors, queues.queueFor(id)));
        }
        this.workers = Collections.unmodifiableList(handles);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Launches every worker. Predictors load on the worker threads, so this
     * returns before the workers report UP.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        if (pinCores) {
            log.warn("Core pinning requested but thread affinity is not available on this JVM; " +
                    "core assignments are advisory only");
        }
        for (WorkerHandle handle : workers) {
            handle.launch(newWorker(handle));
            log.info("Worker started: workerId={}, core={}", handle.getId(), handle.getCoreAffinity());
        }
        log.info("Worker pool started: workers={}, maxBatchSize={}, maxBatchAge={}, sharedQueue={}",
                workerCount, policy.getMaxBatchSize(), policy.getMaxBatchAge(), queues.isShared());
    }

    /**
     * Replaces a dead worker's thread with a fresh one and a freshly loaded predictor.
     *
     * @return false if the pool is not running or the worker is still alive
     */
    public boolean restart(WorkerHandle handle) {
        if (!running.get() || handle.isAlive()) {
            return false;
        }
        int attempt = handle.incrementRestarts();
        log.warn("Restarting worker: workerId={}, attempt={}", handle.getId(), attempt);
        handle.launch(newWorker(handle));
        return true;
    }

    /**
     * Moves requests left on a dead worker's own queue to the live worker with the
     * shortest queue. Requests no other worker can take are answered with a
     * capacity error. No-op with a shared queue, which the other workers still drain.
     *
     * @return number of requests taken off the dead worker's queue
     */
    public int reassignQueued(WorkerHandle dead) {
        if (queues.isShared()) {
            return 0;
        }
        List<ClassificationRequest> stranded = new ArrayList<>();
        dead.getQueue().drainTo(stranded);
        int failed = 0;
        for (ClassificationRequest request : stranded) {
            WorkerHandle target = leastQueuedLiveWorker(dead);
            if (target != null && target.getQueue().offer(request)) {
                continue;
            }
            sink.publish(ClassificationResponse.error(
                    request, ErrorType.CAPACITY_ERROR, "No worker available to process request", dead.getId()));
            failed++;
        }
        if (!stranded.isEmpty()) {
            log.warn("Reassigned queued requests from dead worker: workerId={}, moved={}, failed={}",
                    dead.getId(), stranded.size() - failed, failed);
        }
        return stranded.size();
    }

    private WorkerHandle leastQueuedLiveWorker(WorkerHandle excluded) {
        WorkerHandle best = null;
        for (WorkerHandle candidate : workers) {
            if (candidate == excluded || !candidate.isAlive() || !candidate.isAcceptingWork()) {
                continue;
            }
            if (best == null || candidate.getQueueDepth() < best.getQueueDepth()) {
                best = candidate;
            }
        }
        return best;
    }

    private BatchingWorker newWorker(WorkerHandle handle) {
        return new BatchingWorker(handle, predictorFactory, sink, policy, pollInterval, metrics);
    }

    public List<WorkerHandle> getWorkers() {
        return workers;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    /**
     * Workers whose thread is alive and not known to be down.
     */
    public int getLiveWorkerCount() {
        int live = 0;
        for (WorkerHandle handle : workers) {
            if (handle.isAlive() && handle.getHealth() != WorkerHealth.DOWN) {
                live++;
            }
        }
        return live;
    }

    public RequestQueues getQueues() {
        return queues;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops every worker. Each worker flushes the batch it holds before exiting.
     * Requests still waiting in the queue are not processed.
     */
    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping worker pool: workers={}, queuedRequests={}", workerCount, queues.totalDepth());
        for (WorkerHandle handle : workers) {
            handle.stop(stopTimeout);
        }
        log.info("Worker pool stopped");
    }

    public static final class Builder {
        private int workerCount = 2;
        private int maxWorkers = 4;
        private RequestQueues queues;
        private PredictorFactory predictorFactory;
        private ResponseSink sink;
        private BatchPolicy policy;
        private Duration pollInterval = Duration.ofMillis(10);
        private Duration stopTimeout = Duration.ofSeconds(5);
        private boolean pinCores = false;
        private MetricsRegistry metrics;

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder queues(RequestQueues queues) {
            this.queues = queues;
            return this;
        }

        public Builder predictorFactory(PredictorFactory predictorFactory) {
            this.predictorFactory = predictorFactory;
            return this;
        }

        public Builder sink(ResponseSink sink) {
            this.sink = sink;
            return this;
        }

        public Builder policy(BatchPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
            return this;
        }

        public Builder pinCores(boolean pinCores) {
            this.pinCores = pinCores;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public WorkerPool build() {
            return new WorkerPool(this);
        }
    }
}
