package fr.lapetina.microbatch.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating ResponseEvent instances in the Disruptor ring buffer.
 *
 * The Disruptor pre-allocates events at startup; events are then reused
 * by clearing and re-initializing them.
 */
public final class ResponseEventFactory implements EventFactory<ResponseEvent> {

    @Override
    public ResponseEvent newInstance() {
        return new ResponseEvent();
    }
}
