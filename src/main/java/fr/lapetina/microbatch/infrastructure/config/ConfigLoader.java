package fr.lapetina.microbatch.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration loader.
 *
 * Loads from the file system first, then from the classpath, and validates
 * the result before handing it out.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(ClassifierConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public ClassifierConfig load() {
        return validate(loadFromPath());
    }

    private ClassifierConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private ClassifierConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public ClassifierConfig loadFromStream(InputStream inputStream) {
        return validate(parse(inputStream, "stream"));
    }

    private ClassifierConfig parse(InputStream is, String source) {
        try {
            ClassifierConfig config = yaml.load(is);
            // An empty document yields null
            return config != null ? config : new ClassifierConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks value ranges that would otherwise fail deep inside the pipeline.
     */
    public static ClassifierConfig validate(ClassifierConfig config) {
        ClassifierConfig.WorkersConfig workers = config.getWorkers();
        if (workers.getMax() < 1) {
            throw new ConfigurationException("workers.max must be >= 1, got " + workers.getMax());
        }
        if (workers.getCount() < 1 || workers.getCount() > workers.getMax()) {
            throw new ConfigurationException("workers.count must be in [1, " + workers.getMax()
                    + "], got " + workers.getCount());
        }

        ClassifierConfig.BatchingConfig batching = config.getBatching();
        if (batching.getMaxBatchSize() < 1) {
            throw new ConfigurationException("batching.maxBatchSize must be >= 1");
        }
        if (batching.getMaxBatchAgeMs() < 0 || batching.getPollIntervalMs() < 1) {
            throw new ConfigurationException("batching.maxBatchAgeMs must be >= 0 and pollIntervalMs >= 1");
        }

        if (config.getDispatcher().getRequestTimeoutMs() <= 0) {
            throw new ConfigurationException("dispatcher.requestTimeoutMs must be > 0");
        }
        if (config.getDispatcher().getQueueCapacity() < 1) {
            throw new ConfigurationException("dispatcher.queueCapacity must be >= 1");
        }

        int ringSize = config.getResponses().getRingBufferSize();
        if (ringSize < 1 || Integer.bitCount(ringSize) != 1) {
            throw new ConfigurationException("responses.ringBufferSize must be a power of 2, got " + ringSize);
        }
        return config;
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
