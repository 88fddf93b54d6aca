package fr.lapetina.dopc.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.dopc.domain.event.EventState;
import fr.lapetina.dopc.domain.event.ForwardRequestEvent;
import fr.lapetina.dopc.domain.model.ErrorType;
import fr.lapetina.dopc.domain.model.ForwardResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Final stage handler: makes sure no caller is left waiting, then clears the slot.
 *
 * A dispatched event's future is completed later by the HTTP callback; every other
 * event must have a completed future by the time it reaches this stage.
 */
public final class CompletionHandler implements EventHandler<ForwardRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    @Override
    public void onEvent(ForwardRequestEvent event, long sequence, boolean endOfBatch) {
        try {
            if (event.getRequest() == null) {
                return;
            }
            String requestId = event.getRequest().requestId();
            CompletableFuture<ForwardResponse> future = event.getResponseFuture();

            if (event.getState() != EventState.DISPATCHED && future != null && !future.isDone()) {
                log.error("Request left the pipeline uncompleted: requestId={}, state={}",
                        requestId, event.getState());
                future.complete(ForwardResponse.error(requestId, ErrorType.INTERNAL_ERROR,
                        "Request could not be processed", null, event.getAcceptedAt()));
            }

            if (log.isDebugEnabled()) {
                long pipelineMicros = Duration.between(event.getAcceptedAt(), Instant.now()).toNanos() / 1_000;
                log.debug("Pipeline stage summary: requestId={}, state={}, backend={}, pipelineMicros={}",
                        requestId,
                        event.getState(),
                        event.getSelectedBackend() != null ? event.getSelectedBackend().getId() : "none",
                        pipelineMicros);
            }
        } finally {
            event.clear();
        }
    }
}
