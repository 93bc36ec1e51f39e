/**
 * Event handlers of the response ring, run in order:
 * correlation, metrics, completion.
 */
package fr.lapetina.microbatch.disruptor.handlers;
