package fr.lapetina.microbatch.predictor;

/**
 * Loads a predictor instance for one worker.
 *
 * Called once per worker start (and again on supervised restart), so
 * expensive model loading happens per worker, not per request.
 */
@FunctionalInterface
public interface PredictorFactory {

    /**
     * @param workerId The worker that will own the predictor
     * @return A ready predictor
     * @throws InferenceException if the model cannot be loaded
     */
    Predictor create(int workerId) throws InferenceException;
}
