package fr.lapetina.microbatch;

import fr.lapetina.microbatch.api.HttpServer;
import fr.lapetina.microbatch.infrastructure.config.ClassifierConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the micro-batching classifier.
 */
public class MicroBatchApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MicroBatchApplication.class);

    private final PipelineFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public MicroBatchApplication(String configPath) throws Exception {
        this(PipelineFactory.create(configPath));
    }

    MicroBatchApplication(PipelineFactory factory) throws Exception {
        log.info("Starting micro-batching classifier...");

        this.factory = factory.start();

        ClassifierConfig.ServerConfig server = factory.getConfig().getServer();
        try {
            this.httpServer = new HttpServer(
                    server.getHost(),
                    server.getPort(),
                    server.getBacklog(),
                    server.getThreads(),
                    factory.getDispatcher(),
                    factory.getWorkerPool(),
                    factory.getResponsePipeline(),
                    factory.getMetricsRegistry()
            );
        } catch (IOException | RuntimeException e) {
            log.error("Failed to create HTTP server on port {}, stopping pipeline", server.getPort(), e);
            factory.close();
            throw e;
        }

        log.info("Micro-batching classifier initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Micro-batching classifier started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public PipelineFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    @Override
    public void close() {
        log.info("Shutting down micro-batching classifier...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Micro-batching classifier shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            MicroBatchApplication app = new MicroBatchApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start micro-batching classifier", e);
            System.exit(1);
        }
    }
}
