package fr.lapetina.microbatch.worker;

import fr.lapetina.microbatch.domain.model.ClassificationRequest;
import fr.lapetina.microbatch.domain.model.ClassificationResponse;
import fr.lapetina.microbatch.domain.model.ErrorType;
import fr.lapetina.microbatch.domain.model.FlushTrigger;
import fr.lapetina.microbatch.domain.model.Prediction;
import fr.lapetina.microbatch.domain.model.WorkerHealth;
import fr.lapetina.microbatch.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.microbatch.predictor.InferenceException;
import fr.lapetina.microbatch.predictor.Predictor;
import fr.lapetina.microbatch.predictor.PredictorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * The batching loop run by one worker thread.
 *
 * <p>Loads its own predictor, then repeatedly pulls requests from its queue
 * into a batch and flushes the batch through the predictor when the
 * {@link BatchPolicy} says so. Every member of a flushed batch yields exactly
 * one response, success or error, published to the {@link ResponseSink}.
 * A failing predictor never ends the loop.</p>
 *
 * <p>If the predictor cannot be loaded the thread dies with an
 * {@link IllegalStateException}; the supervisor decides whether to restart it.</p>
 */
public final class BatchingWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BatchingWorker.class);

    private final WorkerHandle handle;
    private final BlockingQueue<ClassificationRequest> queue;
    private final PredictorFactory predictorFactory;
    private final ResponseSink sink;
    private final BatchPolicy policy;
    private final long pollIntervalNanos;
    private final MetricsRegistry metrics;

    private volatile boolean running = true;

    public BatchingWorker(
            WorkerHandle handle,
            PredictorFactory predictorFactory,
            ResponseSink sink,
            BatchPolicy policy,
            Duration pollInterval,
            MetricsRegistry metrics
    ) {
        this.handle = handle;
        this.queue = handle.getQueue();
        this.predictorFactory = predictorFactory;
        this.sink = sink;
        this.policy = policy;
        this.pollIntervalNanos = Math.max(1, pollInterval.toNanos());
        this.metrics = metrics;
    }

    @Override
    public void run() {
        int workerId = handle.getId();
        MDC.put("workerId", String.valueOf(workerId));
        try {
            Predictor predictor = loadPredictor(workerId);
            try (predictor) {
                handle.setHealth(WorkerHealth.UP);
                handle.heartbeat();
                log.info("Worker ready: workerId={}, predictor={}, core={}",
                        workerId, predictor.getName(), handle.getCoreAffinity());
                loop(predictor);
            }
            log.info("Worker stopped: workerId={}", workerId);
        } finally {
            MDC.remove("workerId");
        }
    }

    private Predictor loadPredictor(int workerId) {
        long start = System.nanoTime();
        try {
            Predictor predictor = predictorFactory.create(workerId);
            log.info("Predictor loaded: workerId={}, predictor={}, loadMs={}",
                    workerId, predictor.getName(), (System.nanoTime() - start) / 1_000_000);
            return predictor;
        } catch (InferenceException e) {
            handle.setHealth(WorkerHealth.DOWN);
            throw new IllegalStateException("Worker " + workerId + " failed to load predictor: " + e.getMessage(), e);
        }
    }

    private void loop(Predictor predictor) {
        Batch batch = new Batch(policy.getMaxBatchSize());

        while (running) {
            handle.heartbeat();

            long wait = batch.isEmpty()
                    ? pollIntervalNanos
                    : Math.min(pollIntervalNanos, policy.remainingNanos(batch.ageNanos(System.nanoTime())));

            ClassificationRequest request;
            try {
                request = queue.poll(wait, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            if (request != null) {
                batch.add(request, System.nanoTime());
                batch.drainFrom(queue, System.nanoTime());
            }

            Optional<FlushTrigger> trigger = policy.shouldFlush(batch.size(), batch.ageNanos(System.nanoTime()));
            if (trigger.isPresent()) {
                flush(predictor, batch, trigger.get());
            }
        }

        if (!batch.isEmpty()) {
            flush(predictor, batch, FlushTrigger.SHUTDOWN);
        }
    }

    private void flush(Predictor predictor, Batch batch, FlushTrigger trigger) {
        int workerId = handle.getId();
        List<ClassificationRequest> members = batch.takeAll();
        List<String> payloads = new ArrayList<>(members.size());
        for (ClassificationRequest member : members) {
            payloads.add(member.payload());
        }

        long start = System.nanoTime();
        List<ClassificationResponse> responses = new ArrayList<>(members.size());
        try {
            List<Prediction> predictions = predictor.predict(payloads);
            if (predictions == null || predictions.size() != members.size()) {
                throw new InferenceException("Predictor returned " +
                        (predictions == null ? 0 : predictions.size()) + " results for " + members.size() + " inputs");
            }
            for (int i = 0; i < members.size(); i++) {
                responses.add(ClassificationResponse.success(members.get(i), predictions.get(i), workerId));
            }
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Batch inference failed: workerId={}, size={}, trigger={}, error={}",
                    workerId, members.size(), trigger, message, e);
            responses.clear();
            for (ClassificationRequest member : members) {
                responses.add(ClassificationResponse.error(member, ErrorType.INFERENCE_ERROR, message, workerId));
            }
        }
        Duration inference = Duration.ofNanos(System.nanoTime() - start);

        for (ClassificationResponse response : responses) {
            sink.publish(response);
        }

        handle.recordBatch(members.size());
        metrics.recordBatch(workerId, members.size(), trigger);
        metrics.recordInferenceLatency(workerId, inference);
        log.debug("Batch flushed: workerId={}, size={}, trigger={}, inferenceMs={}",
                workerId, members.size(), trigger, inference.toMillis());
    }

    /**
     * Lets the loop finish its current iteration, flush what it holds, and exit.
     */
    public void requestStop() {
        running = false;
    }
}
