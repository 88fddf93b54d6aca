package fr.lapetina.dopc.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates the ring buffer's {@link ForwardRequestEvent} slots.
 */
public final class ForwardRequestEventFactory implements EventFactory<ForwardRequestEvent> {

    @Override
    public ForwardRequestEvent newInstance() {
        return new ForwardRequestEvent();
    }
}
