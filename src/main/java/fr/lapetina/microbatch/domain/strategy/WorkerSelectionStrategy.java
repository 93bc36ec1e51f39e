package fr.lapetina.microbatch.domain.strategy;

import fr.lapetina.microbatch.worker.WorkerHandle;

import java.util.List;
import java.util.Optional;

/**
 * Strategy for choosing which worker's queue receives a request when
 * requests are routed to per-worker queues.
 *
 * Implementations must be thread-safe as they are called from every
 * submitting thread concurrently.
 */
public interface WorkerSelectionStrategy {

    /**
     * Returns the name of this strategy for configuration and logs.
     */
    String getName();

    /**
     * Selects a worker to receive the next request.
     *
     * @param workers All workers of the pool, in id order
     * @return Selected worker, or empty if none is accepting work
     */
    Optional<WorkerHandle> select(List<WorkerHandle> workers);
}
