package fr.lapetina.dopc.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.dopc.domain.event.EventState;
import fr.lapetina.dopc.domain.event.ForwardRequestEvent;
import fr.lapetina.dopc.domain.model.BackendInstance;
import fr.lapetina.dopc.infrastructure.health.BackendRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * First stage handler: picks the next healthy backend, round-robin.
 */
public final class BackendSelectionHandler implements EventHandler<ForwardRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(BackendSelectionHandler.class);

    static final String NO_BACKEND_MESSAGE = "No healthy services available";

    private final BackendRegistry registry;

    public BackendSelectionHandler(BackendRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onEvent(ForwardRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.getState() != EventState.CREATED) {
            log.debug("Skipping backend selection: sequence={}, state={}", sequence, event.getState());
            return;
        }

        String requestId = event.getRequest().requestId();
        Optional<BackendInstance> selected = registry.selectNext();
        if (selected.isEmpty()) {
            event.markNoBackend(NO_BACKEND_MESSAGE);
            log.warn("No backend available: requestId={}, registered={}", requestId, registry.size());
            return;
        }

        BackendInstance backend = selected.get();
        event.selectBackend(backend);
        log.info("Forwarding to backend: requestId={}, backendId={}, port={}",
                requestId, backend.getId(), backend.getPort());
    }
}
