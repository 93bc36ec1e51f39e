/**
 * Request intake: id assignment, validation, routing onto worker queues and
 * correlation of responses back to waiting callers.
 *
 * <p>Each caller waits on its own completion handle in
 * {@link fr.lapetina.microbatch.dispatcher.PendingRequests}. Responses are matched
 * by request id only, so a caller can never receive another caller's response.
 */
package fr.lapetina.microbatch.dispatcher;
