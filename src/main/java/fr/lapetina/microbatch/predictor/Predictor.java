package fr.lapetina.microbatch.predictor;

import fr.lapetina.microbatch.domain.model.Prediction;

import java.util.List;

/**
 * Batched classification function.
 *
 * Implementations are used by exactly one worker thread and need not be
 * thread-safe. For fixed inputs and a fixed model the output is deterministic.
 */
public interface Predictor extends AutoCloseable {

    /**
     * Returns the name of this predictor for configuration and logs.
     */
    String getName();

    /**
     * Classifies a batch of texts.
     *
     * @param texts Ordered batch of inputs
     * @return One prediction per input, in input order
     * @throws InferenceException if the batch as a whole cannot be classified
     */
    List<Prediction> predict(List<String> texts) throws InferenceException;

    /**
     * Releases model resources. Default no-op.
     */
    @Override
    default void close() {
        // Nothing to release by default
    }
}
