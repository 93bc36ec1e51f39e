package fr.lapetina.microbatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.microbatch.api.dto.ClassifyResponse;
import fr.lapetina.microbatch.dispatcher.Dispatcher;
import fr.lapetina.microbatch.dispatcher.exception.RequestTimeoutException;
import fr.lapetina.microbatch.disruptor.ResponsePipeline;
import fr.lapetina.microbatch.domain.model.ClassificationResponse;
import fr.lapetina.microbatch.domain.model.WorkerHealth;
import fr.lapetina.microbatch.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.microbatch.worker.WorkerHandle;
import fr.lapetina.microbatch.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /classify/{sentence} - Classify one sentence
 * - GET /bert/classify/{sentence} - Alias for classify
 * - GET /health - Worker pool health
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /admin/workers - List all workers
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    static final String CLASSIFY_PATH = "/classify/";
    static final String BERT_CLASSIFY_PATH = "/bert/classify/";

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final Dispatcher dispatcher;
    private final WorkerPool workerPool;
    private final ResponsePipeline responsePipeline;
    private final MetricsRegistry metricsRegistry;

    public HttpServer(
            String host,
            int port,
            int backlog,
            int threads,
            Dispatcher dispatcher,
            WorkerPool workerPool,
            ResponsePipeline responsePipeline,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.dispatcher = dispatcher;
        this.workerPool = workerPool;
        this.responsePipeline = responsePipeline;
        this.metricsRegistry = metricsRegistry;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        InetSocketAddress address = host == null || host.isBlank()
                ? new InetSocketAddress(port)
                : new InetSocketAddress(host, port);
        this.server = com.sun.net.httpserver.HttpServer.create(address, backlog);

        // Each handler thread blocks until its response arrives
        AtomicInteger counter = new AtomicInteger(0);
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "http-handler-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext(CLASSIFY_PATH, new ClassifyHandler(CLASSIFY_PATH));
        server.createContext(BERT_CLASSIFY_PATH, new ClassifyHandler(BERT_CLASSIFY_PATH));
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured: address={}, threads={}", address, threads);
    }

    public void start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
    }

    /**
     * Actual bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== CLASSIFY HANDLER ====================

    private class ClassifyHandler implements HttpHandler {

        private final String prefix;

        ClassifyHandler(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            MDC.put("remote", String.valueOf(exchange.getRemoteAddress()));
            long start = System.nanoTime();

            try {
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                String sentence = extractSentence(exchange.getRequestURI().getPath(), prefix);
                if (sentence.isEmpty()) {
                    sendError(exchange, 404, "Not Found");
                    return;
                }

                ClassificationResponse response;
                try {
                    response = dispatcher.classify(sentence);
                } catch (RequestTimeoutException e) {
                    log.warn("Classification timed out: requestId={}, timeout={}",
                            e.getRequestId(), e.getTimeout());
                    sendError(exchange, 408, "Request timeout");
                    return;
                }

                if (response.isError()) {
                    sendError(exchange, 500, response.errorMessage());
                    return;
                }

                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                sendJson(exchange, 200, ClassifyResponse.success(response, sentence, elapsed));

            } catch (Exception e) {
                log.error("Error handling classify request", e);
                sendError(exchange, 500, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            } finally {
                MDC.clear();
            }
        }
    }

    /**
     * The single path segment after the route prefix, percent-decoded. A literal '+'
     * stays a '+'. Returns an empty string when there is no segment or more than one.
     */
    static String extractSentence(String decodedPath, String prefix) {
        if (decodedPath == null || !decodedPath.startsWith(prefix)) {
            return "";
        }
        String sentence = decodedPath.substring(prefix.length());
        return sentence.indexOf('/') >= 0 ? "" : sentence;
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            Map<String, Object> health = new LinkedHashMap<>();
            String status = determineOverallHealth();
            health.put("status", status);
            health.put("timestamp", System.currentTimeMillis());
            health.put("workers", describeWorkers());

            Map<String, Object> pipelineStats = new LinkedHashMap<>();
            pipelineStats.put("routing", dispatcher.getRouting());
            pipelineStats.put("pendingRequests", dispatcher.getPendingCount());
            pipelineStats.put("queuedRequests", workerPool.getQueues().totalDepth());
            pipelineStats.put("responseRingSize", responsePipeline.getBufferSize());
            pipelineStats.put("responseRingRemaining", responsePipeline.getRemainingCapacity());
            health.put("pipeline", pipelineStats);

            int statusCode = "DOWN".equals(status) ? 503 : 200;
            sendJson(exchange, statusCode, health);
        }

        private String determineOverallHealth() {
            List<WorkerHandle> workers = workerPool.getWorkers();
            long upCount = workers.stream()
                    .filter(w -> w.getHealth() == WorkerHealth.UP)
                    .count();

            if (workerPool.getLiveWorkerCount() == 0) {
                return "DOWN";
            } else if (upCount < workers.size()) {
                return "DEGRADED";
            }
            return "UP";
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/admin/workers") && "GET".equals(method)) {
                    sendJson(exchange, 200, describeWorkers());
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (Exception e) {
                log.error("Error in admin handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private List<Map<String, Object>> describeWorkers() {
        List<Map<String, Object>> workers = new ArrayList<>();
        for (WorkerHandle worker : workerPool.getWorkers()) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("id", worker.getId());
            info.put("core", worker.getCoreAffinity());
            info.put("health", worker.getHealth().name());
            info.put("alive", worker.isAlive());
            info.put("restarts", worker.getRestarts());
            info.put("queueDepth", worker.getQueueDepth());
            info.put("batches", worker.getBatchesProcessed());
            info.put("requests", worker.getRequestsProcessed());
            info.put("startedAt", worker.getStartedAt());
            workers.add(info);
        }
        return workers;
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, ClassifyResponse.error(message != null ? message : "Internal server error"));
    }
}
