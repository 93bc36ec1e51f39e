package fr.lapetina.microbatch.domain.strategy;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory for worker selection strategies, keyed by configuration name.
 */
public final class StrategyFactory {

    private static final Map<String, Supplier<WorkerSelectionStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("round-robin", RoundRobinStrategy::new);
        register("least-queued", LeastQueuedStrategy::new);
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a custom strategy.
     *
     * @param name Strategy name (used in configuration)
     * @param supplier Factory for creating strategy instances
     */
    public static void register(String name, Supplier<WorkerSelectionStrategy> supplier) {
        REGISTRY.put(name.toLowerCase(), supplier);
    }

    /**
     * Creates a strategy by name.
     *
     * @return Strategy instance, or empty if not found
     */
    public static Optional<WorkerSelectionStrategy> create(String name) {
        Supplier<WorkerSelectionStrategy> supplier = REGISTRY.get(name.toLowerCase());
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
