package fr.lapetina.microbatch.integration;

import fr.lapetina.microbatch.dispatcher.exception.RequestTimeoutException;
import fr.lapetina.microbatch.domain.model.ClassLabel;
import fr.lapetina.microbatch.domain.model.ClassificationResponse;
import fr.lapetina.microbatch.domain.model.ErrorType;
import fr.lapetina.microbatch.domain.model.WorkerHealth;
import fr.lapetina.microbatch.predictor.InferenceException;
import fr.lapetina.microbatch.worker.WorkerHandle;
import io.micrometer.core.instrument.Counter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests of dispatcher, worker pool and response ring.
 * Configuration is externalized to test-config.yaml.
 */
class ClassificationPipelineIntegrationTest {

    private TestPipelineFactory factory;

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(condition.getAsBoolean()).as("condition reached within 5s").isTrue();
    }

    @Test
    @DisplayName("should classify a single sentence with the configured lexicon")
    void shouldClassifySingleSentence() {
        factory = TestPipelineFactory.create();

        ClassificationResponse response = factory.getDispatcher().classify("Hello");

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.label()).isEqualTo(ClassLabel.NONE);
        assertThat(response.confidence()).isBetween(0.0, 1.0);
        assertThat(response.workerId()).isBetween(0, 1);
    }

    @Test
    @DisplayName("should route keywords to their labels end to end")
    void shouldClassifyKeywords() {
        factory = TestPipelineFactory.create();

        assertThat(factory.getDispatcher().classify("I want to buy a phone").label()).isEqualTo(ClassLabel.PRODUCT);
        assertThat(factory.getDispatcher().classify("next season of the show").label()).isEqualTo(ClassLabel.SERIES);
    }

    @Test
    @DisplayName("should answer every concurrent caller with its own result")
    void shouldHandleConcurrentCallers() throws Exception {
        factory = TestPipelineFactory.create(StubPredictors.keyword(5));
        ExecutorService callers = Executors.newFixedThreadPool(16);

        List<String> payloads = new ArrayList<>();
        List<CompletableFuture<ClassificationResponse>> futures = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            String payload = (i % 2 == 0 ? "phone " : "season ") + i;
            payloads.add(payload);
            futures.add(CompletableFuture.supplyAsync(() -> factory.getDispatcher().classify(payload), callers));
        }

        Set<Long> ids = new HashSet<>();
        for (int i = 0; i < futures.size(); i++) {
            ClassificationResponse response = futures.get(i).get(10, TimeUnit.SECONDS);
            ClassLabel expected = payloads.get(i).startsWith("phone") ? ClassLabel.PRODUCT : ClassLabel.SERIES;
            assertThat(response.label()).isEqualTo(expected);
            ids.add(response.requestId());
        }
        callers.shutdown();

        assertThat(ids).hasSize(100);
        assertThat(factory.getDispatcher().getPendingCount()).isZero();
    }

    @Test
    @DisplayName("should return an inference error to the caller when the predictor fails")
    void shouldReturnInferenceError() {
        factory = TestPipelineFactory.create(StubPredictors.failing("CUDA out of memory"));

        ClassificationResponse response = factory.getDispatcher().classify("Hello");

        assertThat(response.isError()).isTrue();
        assertThat(response.errorType()).isEqualTo(ErrorType.INFERENCE_ERROR);
        assertThat(response.errorMessage()).isEqualTo("CUDA out of memory");
    }

    @Test
    @DisplayName("should time out slow requests and discard their late responses")
    void shouldTimeOutAndOrphanLateResponses() throws Exception {
        factory = TestPipelineFactory.create(
                config -> config.getDispatcher().setRequestTimeoutMs(100),
                StubPredictors.keyword(400));

        assertThatThrownBy(() -> factory.getDispatcher().classify("Hello"))
                .isInstanceOf(RequestTimeoutException.class);

        await(() -> orphanedResponses() >= 1.0);
        assertThat(factory.getDispatcher().getPendingCount()).isZero();
    }

    @Test
    @DisplayName("should restart a worker whose predictor failed to load")
    void shouldRestartWorkerAfterLoadFailure() throws Exception {
        factory = TestPipelineFactory.create(StubPredictors.flakyLoad(1, StubPredictors.keyword(0)));

        await(() -> factory.getWorkerPool().getWorkers().stream()
                .allMatch(w -> w.getHealth() == WorkerHealth.UP && w.getRestarts() == 1));

        assertThat(factory.getDispatcher().classify("phone").label()).isEqualTo(ClassLabel.PRODUCT);
        assertThat(factory.getWorkerPool().getLiveWorkerCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("should give up restarting after the restart limit and keep serving on the rest")
    void shouldStopRestartingAfterLimit() throws Exception {
        // Worker 0 never loads
        factory = TestPipelineFactory.create(workerId -> {
            if (workerId == 0) {
                throw new InferenceException("broken model");
            }
            return StubPredictors.keyword(0).create(workerId);
        });

        WorkerHandle broken = factory.getWorkerPool().getWorkers().get(0);
        int maxRestarts = factory.getConfig().getSupervisor().getMaxRestarts();
        await(() -> broken.getRestarts() == maxRestarts && !broken.isAlive());
        Thread.sleep(200);

        assertThat(broken.getRestarts()).isEqualTo(maxRestarts);
        assertThat(broken.getHealth()).isEqualTo(WorkerHealth.DOWN);
        assertThat(factory.getWorkerPool().getLiveWorkerCount()).isEqualTo(1);
        assertThat(factory.getDispatcher().classify("season").workerId()).isEqualTo(1);
    }

    @Test
    @DisplayName("should spread requests over workers with directed routing")
    void shouldUseDirectedRouting() throws Exception {
        factory = TestPipelineFactory.create(
                config -> config.getDispatcher().setRouting("round-robin"),
                StubPredictors.keyword(0));

        Set<Integer> workers = new HashSet<>();
        for (int i = 0; i < 4; i++) {
            workers.add(factory.getDispatcher().classify("phone " + i).workerId());
        }

        assertThat(factory.getDispatcher().getRouting()).isEqualTo("round-robin");
        assertThat(workers).containsExactlyInAnyOrder(0, 1);
    }

    @Test
    @DisplayName("should hand requests queued on a worker that never loads to a live worker")
    void shouldReassignRequestsFromWorkerThatNeverLoads() throws Exception {
        factory = TestPipelineFactory.create(
                config -> config.getDispatcher().setRouting("round-robin"),
                workerId -> {
                    if (workerId == 0) {
                        throw new InferenceException("broken model");
                    }
                    return StubPredictors.keyword(0).create(workerId);
                });

        List<CompletableFuture<ClassificationResponse>> futures = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            futures.add(factory.getDispatcher().submit("phone " + i));
        }

        for (CompletableFuture<ClassificationResponse> future : futures) {
            ClassificationResponse response = future.get(5, TimeUnit.SECONDS);
            assertThat(response.label()).isEqualTo(ClassLabel.PRODUCT);
            assertThat(response.workerId()).isEqualTo(1);
        }
        assertThat(factory.getWorkerPool().getWorkers().get(0).getQueueDepth()).isZero();
    }

    private double orphanedResponses() {
        Counter counter = factory.getMetricsRegistry().getRegistry()
                .find("test_orphaned_responses_total")
                .counter();
        return counter == null ? 0 : counter.count();
    }
}
