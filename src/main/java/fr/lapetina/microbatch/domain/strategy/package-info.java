/**
 * Worker selection strategies used when requests are routed to per-worker queues.
 *
 * <p>With the default {@code shared} routing every worker drains one queue and no
 * strategy is involved. Setting {@code dispatcher.routing} to a strategy name gives
 * each worker its own queue and lets the strategy pick the target.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th></tr>
 *   <tr><td>{@code round-robin}</td><td>Cycles through workers in id order</td></tr>
 *   <tr><td>{@code least-queued}</td><td>Picks the worker with the shortest queue</td></tr>
 * </table>
 *
 * <p>Both skip workers that are {@code DOWN} or {@code STOPPED}.
 *
 * @see fr.lapetina.microbatch.domain.strategy.StrategyFactory
 */
package fr.lapetina.microbatch.domain.strategy;
