package fr.lapetina.microbatch.domain.strategy;

import fr.lapetina.microbatch.worker.WorkerHandle;

import java.util.List;
import java.util.Optional;

/**
 * Selects the worker with the fewest requests waiting in its queue.
 * Ties go to the lowest worker id.
 */
public final class LeastQueuedStrategy implements WorkerSelectionStrategy {

    @Override
    public String getName() {
        return "least-queued";
    }

    @Override
    public Optional<WorkerHandle> select(List<WorkerHandle> workers) {
        if (workers == null || workers.isEmpty()) {
            return Optional.empty();
        }

        WorkerHandle selected = null;
        int minDepth = Integer.MAX_VALUE;

        for (WorkerHandle worker : workers) {
            if (!worker.isAcceptingWork()) {
                continue;
            }
            int depth = worker.getQueueDepth();
            if (depth < minDepth) {
                minDepth = depth;
                selected = worker;
            }
        }

        return Optional.ofNullable(selected);
    }
}
