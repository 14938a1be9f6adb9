package fr.lapetina.taskflow.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates {@link RequestEvent} slots for the ring buffer.
 */
public final class RequestEventFactory implements EventFactory<RequestEvent> {

    @Override
    public RequestEvent newInstance() {
        return new RequestEvent();
    }
}
