/**
 * LMAX Disruptor ring carrying responses from the workers back to waiting callers.
 *
 * <h2>Pipeline Stages</h2>
 * <pre>
 * BatchingWorker (x N) → [ring] → Correlation → Metrics → Completion
 * </pre>
 *
 * <p>The ring is pre-allocated and multi-producer. Correlation completes the
 * caller's handle registered under the response's request id; responses with no
 * waiting caller are counted as orphans and discarded.
 *
 * @see fr.lapetina.microbatch.disruptor.ResponsePipeline
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.microbatch.disruptor;
