package fr.lapetina.microbatch.predictor;

import com.sun.net.httpserver.HttpServer;
import fr.lapetina.microbatch.domain.model.ClassLabel;
import fr.lapetina.microbatch.domain.model.Prediction;
import fr.lapetina.microbatch.infrastructure.http.CircuitBreaker;
import fr.lapetina.microbatch.infrastructure.http.ModelServerClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemotePredictorTest {

    private HttpServer modelServer;
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> reply = new AtomicReference<>();
    private final AtomicReference<String> lastRequest = new AtomicReference<>();
    private final AtomicInteger calls = new AtomicInteger();
    private RemotePredictor predictor;
    private ModelServerClient client;

    @BeforeEach
    void setUp() throws IOException {
        modelServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        modelServer.createContext("/predict", exchange -> {
            calls.incrementAndGet();
            lastRequest.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = reply.get().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        modelServer.start();

        client = new ModelServerClient(
                "test-model-server",
                URI.create("http://127.0.0.1:" + modelServer.getAddress().getPort() + "/predict"),
                Duration.ofSeconds(1),
                Duration.ofSeconds(2),
                2,
                Duration.ofMinutes(1)
        );
        predictor = new RemotePredictor(client);
    }

    @AfterEach
    void tearDown() {
        modelServer.stop(0);
    }

    @Test
    @DisplayName("should send the batch and take the argmax of each distribution")
    void shouldPredictBatch() throws Exception {
        reply.set("{\"predictions\":["
                + "{\"probabilities\":[0.1,0.8,0.1]},"
                + "{\"probabilities\":[0.2,0.2,0.6]}]}");

        List<Prediction> predictions = predictor.predict(List.of("buy a phone", "new season"));

        assertThat(lastRequest.get()).isEqualTo("{\"inputs\":[\"buy a phone\",\"new season\"]}");
        assertThat(predictions).extracting(Prediction::label)
                .containsExactly(ClassLabel.PRODUCT, ClassLabel.SERIES);
        assertThat(predictions.get(0).confidence()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("should fail the whole batch on an HTTP error, using the server's error message")
    void shouldFailOnHttpError() {
        status.set(500);
        reply.set("{\"error\":\"CUDA out of memory\"}");

        assertThatThrownBy(() -> predictor.predict(List.of("a")))
                .isInstanceOf(InferenceException.class)
                .hasMessage("Model server returned HTTP 500: CUDA out of memory");
    }

    @Test
    @DisplayName("should fail when the server returns a different number of predictions")
    void shouldFailOnCountMismatch() {
        reply.set("{\"predictions\":[{\"probabilities\":[1.0,0.0,0.0]}]}");

        assertThatThrownBy(() -> predictor.predict(List.of("a", "b")))
                .isInstanceOf(InferenceException.class)
                .hasMessage("Model server returned 1 predictions for 2 inputs");
    }

    @Test
    @DisplayName("should fail on a malformed body")
    void shouldFailOnMalformedBody() {
        reply.set("not json");

        assertThatThrownBy(() -> predictor.predict(List.of("a")))
                .isInstanceOf(InferenceException.class)
                .hasMessageStartingWith("Malformed model server response");
    }

    @Test
    @DisplayName("should stop calling the server once the circuit opens")
    void shouldOpenCircuitAfterFailures() {
        status.set(503);
        reply.set("unavailable");

        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> predictor.predict(List.of("a"))).isInstanceOf(InferenceException.class);
        }
        assertThat(client.getCircuitBreaker().getState()).isEqualTo(CircuitBreaker.State.OPEN);

        assertThatThrownBy(() -> predictor.predict(List.of("a")))
                .isInstanceOf(InferenceException.class)
                .hasMessageStartingWith("Circuit breaker is open");
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reject distributions that do not cover exactly the label set")
    void shouldRejectWrongLength() {
        reply.set("{\"predictions\":[{\"probabilities\":[0.1,0.1,0.1,0.7]}]}");
        assertThatThrownBy(() -> predictor.predict(List.of("a")))
                .isInstanceOf(InferenceException.class)
                .hasMessage("Model server returned 4 probabilities, expected 3");

        reply.set("{\"predictions\":[{\"probabilities\":[1.0]}]}");
        assertThatThrownBy(() -> predictor.predict(List.of("a")))
                .isInstanceOf(InferenceException.class)
                .hasMessage("Model server returned 1 probabilities, expected 3");
    }

    @Test
    @DisplayName("should reject distributions that do not sum to one")
    void shouldRejectUnnormalizedDistribution() {
        reply.set("{\"predictions\":[{\"probabilities\":[0.9,0.9,0.9]}]}");

        assertThatThrownBy(() -> predictor.predict(List.of("a")))
                .isInstanceOf(InferenceException.class)
                .hasMessageContaining("expected 1");
    }

    @Test
    @DisplayName("should reject negative probabilities")
    void shouldRejectNegativeProbability() {
        reply.set("{\"predictions\":[{\"probabilities\":[1.5,-0.5,0.0]}]}");

        assertThatThrownBy(() -> predictor.predict(List.of("a")))
                .isInstanceOf(InferenceException.class)
                .hasMessage("Invalid probability from model server: -0.5");
    }

    @Test
    @DisplayName("should reject non-numeric probabilities")
    void shouldRejectNonNumericProbability() {
        reply.set("{\"predictions\":[{\"probabilities\":[\"a\",\"b\",\"c\"]}]}");

        assertThatThrownBy(() -> predictor.predict(List.of("a")))
                .isInstanceOf(InferenceException.class)
                .hasMessageStartingWith("Non-numeric probability from model server");
    }
}
