package fr.lapetina.microbatch.predictor;

import fr.lapetina.microbatch.domain.model.ClassLabel;
import fr.lapetina.microbatch.domain.model.Prediction;
import fr.lapetina.microbatch.infrastructure.config.ClassifierConfig;
import fr.lapetina.microbatch.infrastructure.http.ModelServerClient;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Predictor delegating each batch to an external model server.
 *
 * The server returns a probability distribution per input; the label is its argmax.
 */
public final class RemotePredictor implements Predictor {

    private static final double SUM_TOLERANCE = 1e-6;

    private final ModelServerClient client;

    public RemotePredictor(ModelServerClient client) {
        this.client = client;
    }

    /**
     * Creates a predictor with its own client and circuit breaker for one worker.
     */
    public static RemotePredictor create(ClassifierConfig.RemoteConfig config, int workerId)
            throws InferenceException {
        URI endpoint;
        try {
            endpoint = URI.create(config.getUrl());
        } catch (IllegalArgumentException e) {
            throw new InferenceException("Invalid model server URL: " + config.getUrl(), e);
        }
        return new RemotePredictor(new ModelServerClient(
                "model-server-worker-" + workerId,
                endpoint,
                Duration.ofMillis(config.getConnectTimeoutMs()),
                Duration.ofMillis(config.getRequestTimeoutMs()),
                config.getCircuitBreakerFailureThreshold(),
                Duration.ofMillis(config.getCircuitBreakerRecoveryMs())
        ));
    }

    @Override
    public String getName() {
        return "remote";
    }

    @Override
    public List<Prediction> predict(List<String> texts) throws InferenceException {
        List<double[]> distributions = client.predict(texts);
        List<Prediction> predictions = new ArrayList<>(distributions.size());
        for (double[] distribution : distributions) {
            checkDistribution(distribution);
            try {
                predictions.add(Prediction.fromDistribution(distribution));
            } catch (IllegalArgumentException e) {
                throw new InferenceException("Invalid distribution from model server: " + e.getMessage(), e);
            }
        }
        return predictions;
    }

    /**
     * A distribution must cover exactly the label set and sum to one.
     */
    static void checkDistribution(double[] distribution) throws InferenceException {
        if (distribution.length != ClassLabel.count()) {
            throw new InferenceException("Model server returned " + distribution.length
                    + " probabilities, expected " + ClassLabel.count());
        }
        double sum = 0.0;
        for (double p : distribution) {
            if (!Double.isFinite(p) || p < 0.0) {
                throw new InferenceException("Invalid probability from model server: " + p);
            }
            sum += p;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new InferenceException("Model server probabilities sum to " + sum + ", expected 1");
        }
    }
}
