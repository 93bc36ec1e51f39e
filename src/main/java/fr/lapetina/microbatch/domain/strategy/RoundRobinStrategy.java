package fr.lapetina.microbatch.domain.strategy;

import fr.lapetina.microbatch.worker.WorkerHandle;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cycles through workers in id order, skipping workers that are down.
 *
 * Thread-safe via atomic counter.
 */
public final class RoundRobinStrategy implements WorkerSelectionStrategy {

    private final AtomicInteger counter = new AtomicInteger(0);

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public Optional<WorkerHandle> select(List<WorkerHandle> workers) {
        if (workers == null || workers.isEmpty()) {
            return Optional.empty();
        }

        int size = workers.size();
        int startIndex = Math.floorMod(counter.getAndIncrement(), size);

        for (int i = 0; i < size; i++) {
            WorkerHandle worker = workers.get((startIndex + i) % size);
            if (worker.isAcceptingWork()) {
                return Optional.of(worker);
            }
        }

        return Optional.empty();
    }
}
