/**
 * Batching workers and their pool.
 *
 * <p>Each {@link fr.lapetina.microbatch.worker.BatchingWorker} runs on its own daemon
 * thread named {@code batch-worker-N}, owns one predictor instance, and flushes a batch
 * when it reaches the configured size or when its oldest member exceeds the configured age.
 *
 * <pre>
 * RequestQueues ──▶ BatchingWorker (x N) ──▶ ResponseSink
 *                          ▲
 *                 WorkerSupervisor (restart / health)
 * </pre>
 */
package fr.lapetina.microbatch.worker;
