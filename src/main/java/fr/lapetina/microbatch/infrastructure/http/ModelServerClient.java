package fr.lapetina.microbatch.infrastructure.http;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.microbatch.predictor.InferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Blocking HTTP client for an external model server.
 *
 * Request body: {@code {"inputs": ["...", ...]}}.
 * Response body: {@code {"predictions": [{"probabilities": [p0, p1, p2]}, ...]}}.
 * Every transport, status or parse failure becomes an {@link InferenceException}.
 * Includes a circuit breaker so a dead server fails batches fast.
 */
public class ModelServerClient {

    private static final Logger log = LoggerFactory.getLogger(ModelServerClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final Duration requestTimeout;
    private final CircuitBreaker circuitBreaker;

    public ModelServerClient(
            String name,
            URI endpoint,
            Duration connectTimeout,
            Duration requestTimeout,
            int failureThreshold,
            Duration circuitBreakerRecoveryTimeout
    ) {
        this.endpoint = endpoint;
        this.requestTimeout = requestTimeout;
        this.circuitBreaker = new CircuitBreaker(name, failureThreshold, circuitBreakerRecoveryTimeout, 1);

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Sends a batch and returns one probability vector per input, in order.
     */
    public List<double[]> predict(List<String> inputs) throws InferenceException {
        if (!circuitBreaker.allowRequest()) {
            throw new InferenceException("Circuit breaker is open for model server: " + endpoint);
        }

        long start = System.nanoTime();
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(
                            objectMapper.writeValueAsString(Map.of("inputs", inputs))))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            circuitBreaker.recordFailure();
            throw new InferenceException("Interrupted while calling model server", e);
        } catch (IOException e) {
            circuitBreaker.recordFailure();
            log.warn("Model server unreachable: endpoint={}, error={}", endpoint, e.getMessage());
            throw new InferenceException("Model server unreachable: " + e.getMessage(), e);
        }

        long latencyMs = (System.nanoTime() - start) / 1_000_000;
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            circuitBreaker.recordFailure();
            log.warn("Model server returned error: endpoint={}, status={}, latencyMs={}",
                    endpoint, status, latencyMs);
            throw new InferenceException("Model server returned HTTP " + status + ": " + extractError(response.body()));
        }

        circuitBreaker.recordSuccess();
        log.debug("Model server call succeeded: endpoint={}, batchSize={}, latencyMs={}",
                endpoint, inputs.size(), latencyMs);
        return parsePredictions(response.body(), inputs.size());
    }

    private List<double[]> parsePredictions(String body, int expected) throws InferenceException {
        JsonNode predictions;
        try {
            predictions = objectMapper.readTree(body).path("predictions");
        } catch (IOException e) {
            throw new InferenceException("Malformed model server response: " + e.getMessage(), e);
        }
        if (!predictions.isArray() || predictions.size() != expected) {
            throw new InferenceException("Model server returned " + predictions.size()
                    + " predictions for " + expected + " inputs");
        }

        List<double[]> result = new ArrayList<>(expected);
        for (JsonNode prediction : predictions) {
            JsonNode probabilities = prediction.path("probabilities");
            if (!probabilities.isArray() || probabilities.isEmpty()) {
                throw new InferenceException("Prediction without probabilities: " + prediction);
            }
            double[] values = new double[probabilities.size()];
            for (int i = 0; i < values.length; i++) {
                JsonNode value = probabilities.get(i);
                if (!value.isNumber()) {
                    throw new InferenceException("Non-numeric probability from model server: " + prediction);
                }
                values[i] = value.asDouble();
            }
            result.add(values);
        }
        return result;
    }

    private String extractError(String body) {
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isTextual()) {
                return error.asText();
            }
        } catch (IOException e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
        }
        return body;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public URI getEndpoint() {
        return endpoint;
    }
}
