package fr.lapetina.microbatch.worker;

import fr.lapetina.microbatch.domain.model.ClassificationResponse;

/**
 * Destination for responses produced by workers.
 * Implementations must accept publications from several workers concurrently
 * and must not drop a response while running.
 */
@FunctionalInterface
public interface ResponseSink {

    void publish(ClassificationResponse response);
}
