package fr.lapetina.microbatch.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.microbatch.dispatcher.PendingRequests;
import fr.lapetina.microbatch.domain.event.ResponseEvent;
import fr.lapetina.microbatch.domain.model.ClassificationResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First stage handler: hands each response to the caller waiting on its request id.
 *
 * A response nobody waits for (the caller timed out or the dispatcher shut
 * down) is marked orphaned and goes no further than the metrics stage.
 */
public final class CorrelationHandler implements EventHandler<ResponseEvent> {

    private static final Logger log = LoggerFactory.getLogger(CorrelationHandler.class);

    private final PendingRequests pending;

    public CorrelationHandler(PendingRequests pending) {
        this.pending = pending;
    }

    @Override
    public void onEvent(ResponseEvent event, long sequence, boolean endOfBatch) {
        event.setSequence(sequence);
        ClassificationResponse response = event.getResponse();
        if (response == null) {
            return;
        }

        if (pending.complete(response)) {
            event.markCorrelated();
            log.debug("Response correlated: requestId={}, workerId={}, sequence={}",
                    response.requestId(), response.workerId(), sequence);
        } else {
            event.markOrphaned();
            log.debug("Dropping orphaned response: requestId={}, workerId={}, sequence={}",
                    response.requestId(), response.workerId(), sequence);
        }
    }
}
