package fr.lapetina.microbatch.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.microbatch.dispatcher.PendingRequests;
import fr.lapetina.microbatch.disruptor.handlers.CompletionHandler;
import fr.lapetina.microbatch.disruptor.handlers.CorrelationHandler;
import fr.lapetina.microbatch.disruptor.handlers.MetricsHandler;
import fr.lapetina.microbatch.domain.event.ResponseEvent;
import fr.lapetina.microbatch.domain.event.ResponseEventFactory;
import fr.lapetina.microbatch.domain.model.ClassificationResponse;
import fr.lapetina.microbatch.infrastructure.config.ClassifierConfig;
import fr.lapetina.microbatch.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.microbatch.worker.ResponseSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Response queue shared by all workers, built on a Disruptor ring buffer.
 *
 * PRODUCER TYPE: MULTI, since every worker thread publishes.
 *
 * PUBLISHING: workers claim slots with the blocking {@code next()}, so a full
 * ring slows workers down instead of losing responses.
 *
 * HANDLERS: correlation -> metrics -> completion, each seeing every event in order.
 *
 * WAIT STRATEGY: configurable, default {@code blocking}. The worker threads are
 * CPU-bound; a spinning consumer would compete with them for cores.
 */
public final class ResponsePipeline implements ResponseSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResponsePipeline.class);

    private final Disruptor<ResponseEvent> disruptor;
    private final RingBuffer<ResponseEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final long shutdownTimeoutMs;

    private ResponsePipeline(Builder builder) {
        this.shutdownTimeoutMs = builder.shutdownTimeoutMs;

        ThreadFactory threadFactory = new PipelineThreadFactory("response-handler");
        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new ResponseEventFactory(),
                builder.ringBufferSize,
                threadFactory,
                ProducerType.MULTI,
                waitStrategy
        );

        disruptor
                .handleEventsWith(new CorrelationHandler(builder.pendingRequests))
                .then(new MetricsHandler(builder.metricsRegistry))
                .then(new CompletionHandler());

        disruptor.setDefaultExceptionHandler(new PipelineExceptionHandler(builder.pendingRequests));

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("ResponsePipeline created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("ResponsePipeline started");
        }
    }

    /**
     * Publishes a response, waiting for a free slot if the ring is full.
     */
    @Override
    public void publish(ClassificationResponse response) {
        if (!running.get()) {
            log.warn("Response dropped, pipeline not running: requestId={}, workerId={}",
                    response.requestId(), response.workerId());
            return;
        }

        long sequence = ringBuffer.next();
        try {
            ResponseEvent event = ringBuffer.get(sequence);
            event.initialize(response);
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /**
     * Returns current ring buffer remaining capacity.
     */
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public int getBufferSize() {
        return ringBuffer.getBufferSize();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Drains published responses, then stops the handler threads.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down ResponsePipeline...");
            try {
                disruptor.shutdown(shutdownTimeoutMs, TimeUnit.MILLISECONDS);
                log.info("ResponsePipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("ResponsePipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class PipelineThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        PipelineThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Fails the waiting caller when a handler throws, so it does not wait for the full timeout.
     */
    private static class PipelineExceptionHandler implements ExceptionHandler<ResponseEvent> {

        private final PendingRequests pendingRequests;

        PipelineExceptionHandler(PendingRequests pendingRequests) {
            this.pendingRequests = pendingRequests;
        }

        @Override
        public void handleEventException(Throwable ex, long sequence, ResponseEvent event) {
            log.error("Exception in response handler: sequence={}, event={}", sequence, event, ex);
            if (event.getResponse() != null) {
                pendingRequests.fail(event.getResponse().requestId(), ex);
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during ResponsePipeline start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during ResponsePipeline shutdown", ex);
        }
    }

    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private long shutdownTimeoutMs = 10_000;
        private PendingRequests pendingRequests;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder shutdownTimeoutMs(long timeoutMs) {
            this.shutdownTimeoutMs = timeoutMs;
            return this;
        }

        public Builder pendingRequests(PendingRequests pendingRequests) {
            this.pendingRequests = pendingRequests;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(ClassifierConfig config) {
            this.ringBufferSize = config.getResponses().getRingBufferSize();
            this.waitStrategy = config.getResponses().getWaitStrategy();
            return this;
        }

        public ResponsePipeline build() {
            if (pendingRequests == null) {
                throw new IllegalStateException("PendingRequests is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new ResponsePipeline(this);
        }
    }
}
