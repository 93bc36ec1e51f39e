package fr.lapetina.microbatch.domain.model;

/**
 * Health status of a batching worker.
 *
 * STARTING: Worker thread spawned, predictor still loading
 * UP: Worker is draining its queue and heartbeating
 * DEGRADED: Worker is alive but its heartbeat is stale (stuck in inference)
 * DOWN: Worker thread terminated unexpectedly
 * STOPPED: Worker was stopped by the pool
 */
public enum WorkerHealth {
    STARTING,
    UP,
    DEGRADED,
    DOWN,
    STOPPED
}
