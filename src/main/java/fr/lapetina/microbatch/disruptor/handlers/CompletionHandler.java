package fr.lapetina.microbatch.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.microbatch.domain.event.EventState;
import fr.lapetina.microbatch.domain.event.ResponseEvent;
import fr.lapetina.microbatch.domain.model.ClassificationResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Final stage handler: logs the outcome and clears the event for reuse.
 */
public final class CompletionHandler implements EventHandler<ResponseEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    @Override
    public void onEvent(ResponseEvent event, long sequence, boolean endOfBatch) {
        try {
            logCompletionSummary(event);
        } finally {
            event.clear();
        }
    }

    private void logCompletionSummary(ResponseEvent event) {
        ClassificationResponse response = event.getResponse();
        if (response == null) {
            return;
        }

        long processingMs = response.processingTime().toMillis();

        if (event.getState() == EventState.ORPHANED) {
            log.info("Response discarded, caller gone: requestId={}, workerId={}, processingMs={}",
                    response.requestId(), response.workerId(), processingMs);
        } else if (response.isSuccess()) {
            log.debug("Request completed: requestId={}, workerId={}, label={}, confidence={}, processingMs={}",
                    response.requestId(), response.workerId(), response.label(),
                    response.confidence(), processingMs);
        } else {
            log.warn("Request failed: requestId={}, workerId={}, processingMs={}, errorType={}, errorMessage={}",
                    response.requestId(), response.workerId(), processingMs,
                    response.errorType(), response.errorMessage());
        }
    }
}
