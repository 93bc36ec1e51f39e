package fr.lapetina.microbatch.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.microbatch.domain.event.EventState;
import fr.lapetina.microbatch.domain.event.ResponseEvent;
import fr.lapetina.microbatch.domain.model.ClassificationResponse;
import fr.lapetina.microbatch.infrastructure.metrics.MetricsRegistry;
import org.slf4j.MDC;

import java.time.Duration;

/**
 * Second stage handler: records response ring metrics.
 *
 * Records:
 * - Time from publication to correlation
 * - Orphaned responses
 */
public final class MetricsHandler implements EventHandler<ResponseEvent> {

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(ResponseEvent event, long sequence, boolean endOfBatch) {
        ClassificationResponse response = event.getResponse();
        if (response == null) {
            return;
        }
        MDC.put("requestId", String.valueOf(response.requestId()));
        MDC.put("workerId", String.valueOf(response.workerId()));
        try {
            if (event.getState() == EventState.ORPHANED) {
                metricsRegistry.incrementOrphanedResponses();
            } else if (event.getState() == EventState.CORRELATED
                    && event.getPublishedAt() != null && event.getCorrelatedAt() != null) {
                metricsRegistry.recordResponseQueueLatency(
                        Duration.between(event.getPublishedAt(), event.getCorrelatedAt()));
            }
        } finally {
            MDC.remove("requestId");
            MDC.remove("workerId");
        }
    }
}
