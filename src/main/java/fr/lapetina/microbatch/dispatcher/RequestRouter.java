package fr.lapetina.microbatch.dispatcher;

import fr.lapetina.microbatch.dispatcher.exception.BackpressureException;
import fr.lapetina.microbatch.domain.model.ClassificationRequest;
import fr.lapetina.microbatch.domain.strategy.WorkerSelectionStrategy;
import fr.lapetina.microbatch.worker.RequestQueues;
import fr.lapetina.microbatch.worker.WorkerHandle;
import fr.lapetina.microbatch.worker.WorkerPool;

import java.util.concurrent.BlockingQueue;

/**
 * Places accepted requests on a worker queue without blocking.
 *
 * With shared queues every request goes to the one FIFO all workers drain.
 * Otherwise the selection strategy picks the target worker.
 */
public final class RequestRouter {

    private final RequestQueues queues;
    private final WorkerPool pool;
    private final WorkerSelectionStrategy strategy;

    private RequestRouter(RequestQueues queues, WorkerPool pool, WorkerSelectionStrategy strategy) {
        this.queues = queues;
        this.pool = pool;
        this.strategy = strategy;
    }

    public static RequestRouter shared(RequestQueues queues) {
        if (!queues.isShared()) {
            throw new IllegalArgumentException("Shared routing needs a shared request queue");
        }
        return new RequestRouter(queues, null, null);
    }

    public static RequestRouter directed(WorkerPool pool, WorkerSelectionStrategy strategy) {
        if (pool.getQueues().isShared()) {
            throw new IllegalArgumentException("Directed routing needs per-worker request queues");
        }
        return new RequestRouter(pool.getQueues(), pool, strategy);
    }

    /**
     * @throws BackpressureException if the target queue is full or no worker accepts work
     */
    public void route(ClassificationRequest request) {
        BlockingQueue<ClassificationRequest> target;
        if (strategy == null) {
            target = queues.queueFor(0);
        } else {
            WorkerHandle worker = strategy.select(pool.getWorkers())
                    .orElseThrow(() -> new BackpressureException(
                            BackpressureException.BackpressureReason.NO_AVAILABLE_WORKER,
                            "strategy=" + strategy.getName()));
            target = worker.getQueue();
        }
        if (!target.offer(request)) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.REQUEST_QUEUE_FULL,
                    "queuedRequests=" + queues.totalDepth());
        }
    }

    public String getRouting() {
        return strategy == null ? "shared" : strategy.getName();
    }
}
