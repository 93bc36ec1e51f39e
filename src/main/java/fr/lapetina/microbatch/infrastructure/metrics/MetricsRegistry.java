package fr.lapetina.microbatch.infrastructure.metrics;

import fr.lapetina.microbatch.domain.model.ErrorType;
import fr.lapetina.microbatch.domain.model.FlushTrigger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Request outcome counters and end-to-end latency
 * - Batch size distribution and flush counters by trigger
 * - Inference latency per worker
 * - Worker pool gauges (live workers, health, restarts)
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    static final String SUCCESS = "SUCCESS";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> flushCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, DistributionSummary> batchSizes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, Timer> inferenceTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, Counter> restartCounters = new ConcurrentHashMap<>();

    private final Timer requestLatency;
    private final Timer responseQueueLatency;
    private final Counter orphanedResponses;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.requestLatency = Timer.builder(prefix + "_request_latency")
                .description("End-to-end latency from submission to response")
                .publishPercentileHistogram()
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);

        this.responseQueueLatency = Timer.builder(prefix + "_response_queue_latency")
                .description("Time a response spent in the response ring before correlation")
                .register(registry);

        this.orphanedResponses = Counter.builder(prefix + "_orphaned_responses_total")
                .description("Responses dropped because no caller was waiting for them")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("microbatch");
    }

    /**
     * Counts a finished request by outcome. A null error type means success.
     */
    public void incrementRequestCount(ErrorType errorType) {
        String outcome = errorType != null ? errorType.name() : SUCCESS;
        requestCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of classification requests by outcome")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records end-to-end request latency.
     */
    public void recordRequestLatency(Duration latency) {
        requestLatency.record(latency);
    }

    /**
     * Records how long a response waited between publish and correlation.
     */
    public void recordResponseQueueLatency(Duration latency) {
        responseQueueLatency.record(latency);
    }

    /**
     * Records one batch flush.
     */
    public void recordBatch(int workerId, int size, FlushTrigger trigger) {
        batchSizes.computeIfAbsent(workerId, id ->
                DistributionSummary.builder(prefix + "_batch_size")
                        .description("Number of requests per flushed batch")
                        .tag("worker", String.valueOf(id))
                        .register(registry)
        ).record(size);

        flushCounters.computeIfAbsent(trigger.name(), k ->
                Counter.builder(prefix + "_batch_flushes_total")
                        .description("Batch flushes by trigger")
                        .tag("trigger", trigger.name().toLowerCase())
                        .register(registry)
        ).increment();
    }

    /**
     * Records predictor latency for one batch.
     */
    public void recordInferenceLatency(int workerId, Duration latency) {
        inferenceTimers.computeIfAbsent(workerId, id ->
                Timer.builder(prefix + "_inference_latency")
                        .description("Predictor latency per batch")
                        .tag("worker", String.valueOf(id))
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void incrementOrphanedResponses() {
        orphanedResponses.increment();
    }

    public void incrementWorkerRestarts(int workerId) {
        restartCounters.computeIfAbsent(workerId, id ->
                Counter.builder(prefix + "_worker_restarts_total")
                        .description("Worker restarts performed by the supervisor")
                        .tag("worker", String.valueOf(id))
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for requests awaiting a response.
     */
    public void registerPendingRequests(Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_pending_requests", valueSupplier, s -> s.get().doubleValue())
                .description("Requests waiting for a response")
                .register(registry);
    }

    /**
     * Registers a gauge for requests queued and not yet drained by a worker.
     */
    public void registerQueueDepth(Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_request_queue_depth", valueSupplier, s -> s.get().doubleValue())
                .description("Requests waiting in the request queue(s)")
                .register(registry);
    }

    /**
     * Registers a gauge for the number of live workers.
     */
    public void registerLiveWorkers(Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_live_workers", valueSupplier, s -> s.get().doubleValue())
                .description("Workers whose thread is alive")
                .register(registry);
    }

    /**
     * Registers a gauge for one worker's health.
     */
    public void registerWorkerHealth(int workerId, Supplier<Number> healthValue) {
        Gauge.builder(prefix + "_worker_health", healthValue, s -> s.get().doubleValue())
                .description("Worker health status (0=DOWN/STOPPED, 1=STARTING/DEGRADED, 2=UP)")
                .tag("worker", String.valueOf(workerId))
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
