package fr.lapetina.microbatch;

import fr.lapetina.microbatch.dispatcher.Dispatcher;
import fr.lapetina.microbatch.dispatcher.PendingRequests;
import fr.lapetina.microbatch.dispatcher.RequestIdGenerator;
import fr.lapetina.microbatch.dispatcher.RequestRouter;
import fr.lapetina.microbatch.disruptor.ResponsePipeline;
import fr.lapetina.microbatch.domain.strategy.StrategyFactory;
import fr.lapetina.microbatch.domain.strategy.WorkerSelectionStrategy;
import fr.lapetina.microbatch.infrastructure.config.ClassifierConfig;
import fr.lapetina.microbatch.infrastructure.config.ConfigLoader;
import fr.lapetina.microbatch.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.microbatch.predictor.PredictorFactory;
import fr.lapetina.microbatch.predictor.PredictorRegistry;
import fr.lapetina.microbatch.worker.BatchPolicy;
import fr.lapetina.microbatch.worker.RequestQueues;
import fr.lapetina.microbatch.worker.WorkerHandle;
import fr.lapetina.microbatch.worker.WorkerPool;
import fr.lapetina.microbatch.worker.WorkerSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Factory for creating a fully-wired classification pipeline from configuration.
 * This is the primary entry point for obtaining a configured {@link Dispatcher}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (PipelineFactory factory = PipelineFactory.create("config.yaml").start()) {
 *     ClassificationResponse response = factory.getDispatcher().classify("Hello");
 * }
 * }</pre>
 */
public class PipelineFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    private final ClassifierConfig config;
    private final MetricsRegistry metricsRegistry;
    private final PendingRequests pendingRequests;
    private final ResponsePipeline responsePipeline;
    private final RequestQueues requestQueues;
    private final WorkerPool workerPool;
    private final WorkerSupervisor supervisor;
    private final Dispatcher dispatcher;

    protected PipelineFactory(ClassifierConfig config, PredictorFactory predictorOverride) {
        this.config = ConfigLoader.validate(config);

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Response side: handles registered by the dispatcher, completed from the ring
        this.pendingRequests = new PendingRequests();
        this.responsePipeline = ResponsePipeline.builder()
                .fromConfig(config)
                .pendingRequests(pendingRequests)
                .metricsRegistry(metricsRegistry)
                .build();

        // Request side
        String routing = config.getDispatcher().getRouting();
        boolean shared = "shared".equalsIgnoreCase(routing);
        int capacity = config.getDispatcher().getQueueCapacity();
        this.requestQueues = shared ? RequestQueues.shared(capacity) : RequestQueues.perWorker(capacity);

        // Predictor (allow override for testing)
        PredictorFactory predictorFactory = predictorOverride != null
                ? predictorOverride
                : PredictorRegistry.create(config.getModel())
                        .orElseThrow(() -> new ConfigLoader.ConfigurationException(
                                "Unknown predictor: " + config.getModel().getPredictor() +
                                        ". Available: " + PredictorRegistry.getRegisteredNames()));

        ClassifierConfig.BatchingConfig batching = config.getBatching();
        this.workerPool = WorkerPool.builder()
                .workerCount(config.getWorkers().getCount())
                .maxWorkers(config.getWorkers().getMax())
                .pinCores(config.getWorkers().isPinCores())
                .queues(requestQueues)
                .predictorFactory(predictorFactory)
                .sink(responsePipeline)
                .policy(new BatchPolicy(batching.getMaxBatchSize(), Duration.ofMillis(batching.getMaxBatchAgeMs())))
                .pollInterval(Duration.ofMillis(batching.getPollIntervalMs()))
                .metrics(metricsRegistry)
                .build();

        ClassifierConfig.SupervisorConfig supervision = config.getSupervisor();
        this.supervisor = supervision.isEnabled()
                ? new WorkerSupervisor(
                        workerPool,
                        metricsRegistry,
                        Duration.ofMillis(supervision.getIntervalMs()),
                        Duration.ofMillis(supervision.getHeartbeatTimeoutMs()),
                        supervision.getMaxRestarts())
                : null;

        RequestRouter router = shared
                ? RequestRouter.shared(requestQueues)
                : RequestRouter.directed(workerPool, createStrategy(routing));

        this.dispatcher = new Dispatcher(
                router,
                pendingRequests,
                new RequestIdGenerator(),
                Duration.ofMillis(config.getDispatcher().getRequestTimeoutMs()),
                config.getValidation().getMaxPayloadLength(),
                metricsRegistry
        );

        registerPipelineMetrics();

        log.info("PipelineFactory initialized: workers={}, routing={}, predictor={}",
                workerPool.getWorkerCount(), router.getRouting(), config.getModel().getPredictor());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static PipelineFactory create(String configPath) {
        log.info("Initializing PipelineFactory from config: {}", configPath);
        return new PipelineFactory(new ConfigLoader(configPath).load(), null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static PipelineFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the response ring, the workers and the supervisor, in that order.
     */
    public PipelineFactory start() {
        responsePipeline.start();
        workerPool.start();
        if (supervisor != null) {
            supervisor.start();
        }
        log.info("Pipeline started");
        return this;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public WorkerPool getWorkerPool() {
        return workerPool;
    }

    public WorkerSupervisor getSupervisor() {
        return supervisor;
    }

    public ResponsePipeline getResponsePipeline() {
        return responsePipeline;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ClassifierConfig getConfig() {
        return config;
    }

    private static WorkerSelectionStrategy createStrategy(String routing) {
        return StrategyFactory.create(routing)
                .orElseThrow(() -> new ConfigLoader.ConfigurationException(
                        "Unknown routing: " + routing + ". Available: shared, " +
                                StrategyFactory.getRegisteredNames()));
    }

    private void registerPipelineMetrics() {
        metricsRegistry.registerPendingRequests(pendingRequests::size);
        metricsRegistry.registerQueueDepth(requestQueues::totalDepth);
        metricsRegistry.registerLiveWorkers(workerPool::getLiveWorkerCount);
        for (WorkerHandle worker : workerPool.getWorkers()) {
            metricsRegistry.registerWorkerHealth(worker.getId(), () -> {
                return switch (worker.getHealth()) {
                    case UP -> 2;
                    case STARTING, DEGRADED -> 1;
                    case DOWN, STOPPED -> 0;
                };
            });
        }
    }

    /**
     * Shuts down in dependency order: stop supervision, let workers flush their
     * batches, drain the response ring, then fail whoever is still waiting.
     */
    @Override
    public void close() {
        log.info("Shutting down PipelineFactory...");

        if (supervisor != null) {
            try {
                supervisor.close();
            } catch (Exception e) {
                log.warn("Error closing worker supervisor", e);
            }
        }

        try {
            workerPool.close();
        } catch (Exception e) {
            log.warn("Error closing worker pool", e);
        }

        try {
            responsePipeline.close();
        } catch (Exception e) {
            log.warn("Error closing response pipeline", e);
        }

        try {
            dispatcher.close();
        } catch (Exception e) {
            log.warn("Error closing dispatcher", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("PipelineFactory shut down");
    }
}
