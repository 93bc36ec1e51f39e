package fr.lapetina.microbatch.infrastructure.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the classifier front end.
 * Designed to be populated from YAML.
 */
public class ClassifierConfig {

    private ServerConfig server = new ServerConfig();
    private ModelConfig model = new ModelConfig();
    private WorkersConfig workers = new WorkersConfig();
    private BatchingConfig batching = new BatchingConfig();
    private DispatcherConfig dispatcher = new DispatcherConfig();
    private ResponsesConfig responses = new ResponsesConfig();
    private SupervisorConfig supervisor = new SupervisorConfig();
    private ValidationConfig validation = new ValidationConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public ModelConfig getModel() { return model; }
    public void setModel(ModelConfig model) { this.model = model; }

    public WorkersConfig getWorkers() { return workers; }
    public void setWorkers(WorkersConfig workers) { this.workers = workers; }

    public BatchingConfig getBatching() { return batching; }
    public void setBatching(BatchingConfig batching) { this.batching = batching; }

    public DispatcherConfig getDispatcher() { return dispatcher; }
    public void setDispatcher(DispatcherConfig dispatcher) { this.dispatcher = dispatcher; }

    public ResponsesConfig getResponses() { return responses; }
    public void setResponses(ResponsesConfig responses) { this.responses = responses; }

    public SupervisorConfig getSupervisor() { return supervisor; }
    public void setSupervisor(SupervisorConfig supervisor) { this.supervisor = supervisor; }

    public ValidationConfig getValidation() { return validation; }
    public void setValidation(ValidationConfig validation) { this.validation = validation; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 5000;
        private String host = "0.0.0.0";
        private int backlog = 2048;
        private int threads = 16;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * Model and predictor configuration.
     */
    public static class ModelConfig {
        private String path = "./multi_base";
        private String predictor = "lexicon";
        private double keywordWeight = 2.0;
        private Map<String, List<String>> lexicon = new LinkedHashMap<>();
        private RemoteConfig remote = new RemoteConfig();

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public String getPredictor() { return predictor; }
        public void setPredictor(String predictor) { this.predictor = predictor; }

        public double getKeywordWeight() { return keywordWeight; }
        public void setKeywordWeight(double keywordWeight) { this.keywordWeight = keywordWeight; }

        public Map<String, List<String>> getLexicon() { return lexicon; }
        public void setLexicon(Map<String, List<String>> lexicon) { this.lexicon = lexicon; }

        public RemoteConfig getRemote() { return remote; }
        public void setRemote(RemoteConfig remote) { this.remote = remote; }
    }

    /**
     * Remote model server settings, used by the {@code remote} predictor.
     */
    public static class RemoteConfig {
        private String url = "http://localhost:8501/v1/models/classifier:predict";
        private long connectTimeoutMs = 5000;
        private long requestTimeoutMs = 10000;
        private int circuitBreakerFailureThreshold = 5;
        private long circuitBreakerRecoveryMs = 30000;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public int getCircuitBreakerFailureThreshold() { return circuitBreakerFailureThreshold; }
        public void setCircuitBreakerFailureThreshold(int threshold) { this.circuitBreakerFailureThreshold = threshold; }

        public long getCircuitBreakerRecoveryMs() { return circuitBreakerRecoveryMs; }
        public void setCircuitBreakerRecoveryMs(long ms) { this.circuitBreakerRecoveryMs = ms; }
    }

    /**
     * Worker pool sizing.
     */
    public static class WorkersConfig {
        private int count = 2;
        private int max = 4;
        private boolean pinCores = true;

        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }

        public int getMax() { return max; }
        public void setMax(int max) { this.max = max; }

        public boolean isPinCores() { return pinCores; }
        public void setPinCores(boolean pinCores) { this.pinCores = pinCores; }
    }

    /**
     * Batch flush policy.
     */
    public static class BatchingConfig {
        private int maxBatchSize = 32;
        private long maxBatchAgeMs = 100;
        private long pollIntervalMs = 10;

        public int getMaxBatchSize() { return maxBatchSize; }
        public void setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = maxBatchSize; }

        public long getMaxBatchAgeMs() { return maxBatchAgeMs; }
        public void setMaxBatchAgeMs(long maxBatchAgeMs) { this.maxBatchAgeMs = maxBatchAgeMs; }

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    }

    /**
     * Request admission and wait budget.
     */
    public static class DispatcherConfig {
        private long requestTimeoutMs = 30000;
        private int queueCapacity = 10000;
        private String routing = "shared";

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }

        public String getRouting() { return routing; }
        public void setRouting(String routing) { this.routing = routing; }
    }

    /**
     * LMAX Disruptor configuration for the response ring.
     */
    public static class ResponsesConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Worker supervision configuration.
     */
    public static class SupervisorConfig {
        private boolean enabled = true;
        private long intervalMs = 1000;
        private long heartbeatTimeoutMs = 5000;
        private int maxRestarts = 3;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getHeartbeatTimeoutMs() { return heartbeatTimeoutMs; }
        public void setHeartbeatTimeoutMs(long heartbeatTimeoutMs) { this.heartbeatTimeoutMs = heartbeatTimeoutMs; }

        public int getMaxRestarts() { return maxRestarts; }
        public void setMaxRestarts(int maxRestarts) { this.maxRestarts = maxRestarts; }
    }

    /**
     * Request validation configuration.
     */
    public static class ValidationConfig {
        private int maxPayloadLength = 10000;

        public int getMaxPayloadLength() { return maxPayloadLength; }
        public void setMaxPayloadLength(int maxPayloadLength) { this.maxPayloadLength = maxPayloadLength; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "microbatch";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
