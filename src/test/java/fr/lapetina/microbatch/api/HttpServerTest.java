package fr.lapetina.microbatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.microbatch.integration.StubPredictors;
import fr.lapetina.microbatch.integration.TestPipelineFactory;
import fr.lapetina.microbatch.predictor.PredictorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class HttpServerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final HttpClient CLIENT = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(2))
            .build();

    private TestPipelineFactory factory;
    private HttpServer server;

    private void startServer(TestPipelineFactory pipeline) throws IOException {
        factory = pipeline;
        server = new HttpServer(
                "127.0.0.1",
                0,
                16,
                8,
                factory.getDispatcher(),
                factory.getWorkerPool(),
                factory.getResponsePipeline(),
                factory.getMetricsRegistry()
        );
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
        if (factory != null) {
            factory.close();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path))
                .timeout(Duration.ofSeconds(10))
                .GET()
                .build();
        return CLIENT.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Nested
    @DisplayName("Classify endpoint")
    class Classify {

        @BeforeEach
        void setUp() throws IOException {
            startServer(TestPipelineFactory.create());
        }

        @Test
        @DisplayName("should return the label, sentence, confidence, timing and worker")
        void shouldReturnClassification() throws Exception {
            HttpResponse<String> response = get("/classify/Hello");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValue("application/json");

            JsonNode body = MAPPER.readTree(response.body());
            assertThat(body.get("class").asText()).isEqualTo("none");
            assertThat(body.get("sentence").asText()).isEqualTo("Hello");
            assertThat(body.get("confidence").asDouble()).isBetween(0.0, 1.0);
            assertThat(body.get("processing_time").asDouble()).isGreaterThanOrEqualTo(0.0);
            assertThat(body.get("worker_id").asInt()).isBetween(0, 1);
            assertThat(body.has("error")).isFalse();
        }

        @Test
        @DisplayName("should percent-decode the sentence from the path")
        void shouldDecodeSentence() throws Exception {
            HttpResponse<String> response = get("/classify/I%20want%20to%20buy%20a%20phone");

            JsonNode body = MAPPER.readTree(response.body());
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(body.get("sentence").asText()).isEqualTo("I want to buy a phone");
            assertThat(body.get("class").asText()).isEqualTo("product");
        }

        @Test
        @DisplayName("should serve the legacy /bert/classify route")
        void shouldServeLegacyRoute() throws Exception {
            HttpResponse<String> response = get("/bert/classify/next%20season");

            JsonNode body = MAPPER.readTree(response.body());
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(body.get("class").asText()).isEqualTo("series");
        }

        @Test
        @DisplayName("should return 404 when the sentence is empty")
        void shouldRejectEmptySentence() throws Exception {
            HttpResponse<String> response = get("/classify/");

            assertThat(response.statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should return 404 when the sentence spans more than one path segment")
        void shouldRejectMultiSegmentSentence() throws Exception {
            assertThat(get("/classify/a/b").statusCode()).isEqualTo(404);
            assertThat(get("/classify/a%2Fb").statusCode()).isEqualTo(404);
            assertThat(get("/classify/Hello/").statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should return 405 for non-GET requests")
        void shouldRejectPost() throws Exception {
            HttpRequest request = HttpRequest.newBuilder(
                            URI.create("http://127.0.0.1:" + server.getPort() + "/classify/Hello"))
                    .POST(HttpRequest.BodyPublishers.ofString("{}"))
                    .build();

            HttpResponse<String> response = CLIENT.send(request, HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(405);
        }

        @Test
        @DisplayName("should return 500 with the validation message for oversized sentences")
        void shouldRejectOversizedSentence() throws Exception {
            HttpResponse<String> response = get("/classify/" + "a".repeat(250));

            JsonNode body = MAPPER.readTree(response.body());
            assertThat(response.statusCode()).isEqualTo(500);
            assertThat(body.get("error").asText()).startsWith("Payload exceeds maximum length");
        }
    }

    @Nested
    @DisplayName("Operational endpoints")
    class Operational {

        @BeforeEach
        void setUp() throws IOException {
            startServer(TestPipelineFactory.create());
        }

        @Test
        @DisplayName("should report health with per-worker details")
        void shouldReportHealth() throws Exception {
            HttpResponse<String> response = get("/health");

            JsonNode body = MAPPER.readTree(response.body());
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(body.get("status").asText()).isIn("UP", "DEGRADED");
            assertThat(body.get("workers")).hasSize(2);
            assertThat(body.get("pipeline").get("routing").asText()).isEqualTo("shared");
            assertThat(body.get("pipeline").get("responseRingSize").asInt()).isEqualTo(256);
        }

        @Test
        @DisplayName("should expose Prometheus metrics")
        void shouldExposeMetrics() throws Exception {
            get("/classify/Hello");

            HttpResponse<String> response = get("/metrics");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("test_requests_total");
            assertThat(response.body()).contains("test_batch_flushes_total");
        }

        @Test
        @DisplayName("should list workers on the admin endpoint")
        void shouldListWorkers() throws Exception {
            HttpResponse<String> response = get("/admin/workers");

            JsonNode body = MAPPER.readTree(response.body());
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(body.isArray()).isTrue();
            assertThat(body.get(0).get("id").asInt()).isZero();
            assertThat(body.get(1).get("id").asInt()).isEqualTo(1);
        }

        @Test
        @DisplayName("should return 404 for unknown admin paths")
        void shouldRejectUnknownAdminPath() throws Exception {
            assertThat(get("/admin/unknown").statusCode()).isEqualTo(404);
        }
    }

    @Nested
    @DisplayName("Failure mapping")
    class Failures {

        private void startWith(PredictorFactory predictors) throws IOException {
            startServer(TestPipelineFactory.create(predictors));
        }

        @Test
        @DisplayName("should return 500 with the predictor error message")
        void shouldMapInferenceErrorTo500() throws Exception {
            startWith(StubPredictors.failing("model exploded"));

            HttpResponse<String> response = get("/classify/Hello");

            JsonNode body = MAPPER.readTree(response.body());
            assertThat(response.statusCode()).isEqualTo(500);
            assertThat(body.get("error").asText()).isEqualTo("model exploded");
            assertThat(body.has("class")).isFalse();
        }

        @Test
        @DisplayName("should return 408 when no response arrives in time")
        void shouldMapTimeoutTo408() throws Exception {
            startServer(TestPipelineFactory.create(
                    config -> config.getDispatcher().setRequestTimeoutMs(100),
                    StubPredictors.keyword(500)));

            HttpResponse<String> response = get("/classify/Hello");

            JsonNode body = MAPPER.readTree(response.body());
            assertThat(response.statusCode()).isEqualTo(408);
            assertThat(body.get("error").asText()).isEqualTo("Request timeout");
        }
    }

    @Test
    @DisplayName("should take everything after the prefix as the sentence")
    void shouldExtractSentence() {
        assertThat(HttpServer.extractSentence("/classify/a b", "/classify/")).isEqualTo("a b");
        assertThat(HttpServer.extractSentence("/classify/a b/c", "/classify/")).isEmpty();
        assertThat(HttpServer.extractSentence("/classify/1+1", "/classify/")).isEqualTo("1+1");
        assertThat(HttpServer.extractSentence("/classify/", "/classify/")).isEmpty();
        assertThat(HttpServer.extractSentence("/other", "/classify/")).isEmpty();
    }
}
