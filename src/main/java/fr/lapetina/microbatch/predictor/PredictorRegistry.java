package fr.lapetina.microbatch.predictor;

import fr.lapetina.microbatch.infrastructure.config.ClassifierConfig;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registry resolving a predictor name from configuration to a factory.
 */
public final class PredictorRegistry {

    private static final Map<String, Function<ClassifierConfig.ModelConfig, PredictorFactory>> REGISTRY =
            new ConcurrentHashMap<>();

    static {
        register("lexicon", config -> workerId -> LexiconPredictor.load(config));
        register("remote", config -> workerId -> RemotePredictor.create(config.getRemote(), workerId));
    }

    private PredictorRegistry() {
        // Utility class
    }

    /**
     * Registers a custom predictor type.
     *
     * @param name Predictor name (used in configuration)
     * @param factory Builds a per-worker factory from the model configuration
     */
    public static void register(String name, Function<ClassifierConfig.ModelConfig, PredictorFactory> factory) {
        REGISTRY.put(name.toLowerCase(), factory);
    }

    /**
     * Resolves the predictor named in the model configuration.
     *
     * @return Factory, or empty if the name is unknown
     */
    public static Optional<PredictorFactory> create(ClassifierConfig.ModelConfig config) {
        Function<ClassifierConfig.ModelConfig, PredictorFactory> factory =
                REGISTRY.get(config.getPredictor().toLowerCase());
        if (factory == null) {
            return Optional.empty();
        }
        return Optional.of(factory.apply(config));
    }

    /**
     * Returns all registered predictor names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
