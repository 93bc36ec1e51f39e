/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing and range validation.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog, handler threads)</li>
 *   <li>{@code model} - Model path and predictor selection</li>
 *   <li>{@code workers} - Worker count, maximum and core pinning</li>
 *   <li>{@code batching} - Batch size, batch age and queue poll interval</li>
 *   <li>{@code dispatcher} - Wait budget, queue capacity and routing mode</li>
 *   <li>{@code responses} - Response ring buffer and wait strategy</li>
 *   <li>{@code supervisor} - Worker health checks and restart policy</li>
 *   <li>{@code validation} - Payload limits</li>
 *   <li>{@code metrics} - Prometheus metrics prefix</li>
 * </ul>
 *
 * @see fr.lapetina.microbatch.infrastructure.config.ClassifierConfig
 * @see fr.lapetina.microbatch.infrastructure.config.ConfigLoader
 */
package fr.lapetina.microbatch.infrastructure.config;
