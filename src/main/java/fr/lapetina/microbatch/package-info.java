/**
 * Micro-batching classifier - a latency-bounded batching front end for sentence classification.
 *
 * <p>Requests arriving one at a time over HTTP are queued, grouped into batches by a pool of
 * worker threads, classified in a single predictor call per batch, and returned to each
 * waiting caller through an LMAX Disruptor response ring.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.microbatch.PipelineFactory} - Main entry point for creating
 *       a fully-configured pipeline from YAML configuration</li>
 *   <li>{@link fr.lapetina.microbatch.MicroBatchApplication} - Standalone HTTP server</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (PipelineFactory factory = PipelineFactory.create("config.yaml").start()) {
 *     ClassificationResponse response = factory.getDispatcher().classify("Hello");
 *     System.out.println(response.label());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Batches flushed on size or age, whichever comes first</li>
 *   <li>Per-request timeout with id-based correlation</li>
 *   <li>Supervised workers, restarted when they die</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 *   <li>Backpressure via a bounded request queue</li>
 * </ul>
 *
 * @see fr.lapetina.microbatch.PipelineFactory
 * @see fr.lapetina.microbatch.dispatcher.Dispatcher
 */
package fr.lapetina.microbatch;
