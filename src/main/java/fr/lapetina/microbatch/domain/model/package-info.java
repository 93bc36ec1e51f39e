/**
 * Domain model classes representing core concepts of the classifier front end.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.microbatch.domain.model.ClassificationRequest} - Immutable request consumed by one worker</li>
 *   <li>{@link fr.lapetina.microbatch.domain.model.ClassificationResponse} - Immutable result or error for one request</li>
 *   <li>{@link fr.lapetina.microbatch.domain.model.Prediction} - Label, confidence and distribution from a predictor</li>
 *   <li>{@link fr.lapetina.microbatch.domain.model.ClassLabel} - The fixed label set (none, product, series)</li>
 *   <li>{@link fr.lapetina.microbatch.domain.model.WorkerHealth} - Worker health states</li>
 *   <li>{@link fr.lapetina.microbatch.domain.model.ErrorType} - Categorized error types for responses</li>
 * </ul>
 */
package fr.lapetina.microbatch.domain.model;
