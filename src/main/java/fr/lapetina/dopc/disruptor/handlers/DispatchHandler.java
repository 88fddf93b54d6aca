package fr.lapetina.dopc.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.dopc.domain.event.EventState;
import fr.lapetina.dopc.domain.event.ForwardRequestEvent;
import fr.lapetina.dopc.domain.model.BackendInstance;
import fr.lapetina.dopc.domain.model.ErrorType;
import fr.lapetina.dopc.domain.model.ForwardRequest;
import fr.lapetina.dopc.domain.model.ForwardResponse;
import fr.lapetina.dopc.infrastructure.http.BackendHttpClient;
import fr.lapetina.dopc.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Second stage handler: relays the request to the selected backend.
 *
 * The HTTP call is asynchronous; its callback completes the caller's future.
 * The callback works on values copied out of the event, since the slot is
 * recycled as soon as the last handler has seen it.
 */
public final class DispatchHandler implements EventHandler<ForwardRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    private final BackendHttpClient httpClient;
    private final MetricsRegistry metricsRegistry;
    private final long forwardTimeoutMs;

    public DispatchHandler(BackendHttpClient httpClient, MetricsRegistry metricsRegistry, long forwardTimeoutMs) {
        this.httpClient = httpClient;
        this.metricsRegistry = metricsRegistry;
        this.forwardTimeoutMs = forwardTimeoutMs;
    }

    @Override
    public void onEvent(ForwardRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            completeWithError(event);
            return;
        }

        if (event.getState() != EventState.BACKEND_SELECTED) {
            event.markFailed(ErrorType.INTERNAL_ERROR, "Invalid state for dispatch: " + event.getState());
            completeWithError(event);
            return;
        }

        dispatch(event);
    }

    private void dispatch(ForwardRequestEvent event) {
        ForwardRequest request = event.getRequest();
        BackendInstance backend = event.getSelectedBackend();
        CompletableFuture<ForwardResponse> future = event.getResponseFuture();
        Instant startTime = Instant.now();
        event.markDispatched();

        httpClient.forward(backend, request)
                .orTimeout(forwardTimeoutMs, TimeUnit.MILLISECONDS)
                .whenComplete((response, throwable) -> {
                    ForwardResponse result = throwable == null
                            ? response
                            : timeoutResponse(request, backend, throwable, startTime);
                    if (metricsRegistry != null) {
                        metricsRegistry.recordForward(backend.getId(), result.statusCode(), result.latency());
                        if (!result.isRelayed()) {
                            metricsRegistry.incrementErrorCount(result.errorType());
                        }
                    }
                    log.info("Response from backend: requestId={}, backendId={}, status={}, latencyMs={}",
                            request.requestId(), backend.getId(), result.statusCode(), result.latency().toMillis());
                    if (future != null) {
                        future.complete(result);
                    }
                });
    }

    private ForwardResponse timeoutResponse(
            ForwardRequest request,
            BackendInstance backend,
            Throwable throwable,
            Instant startTime
    ) {
        String message = throwable instanceof TimeoutException
                ? "Load balancer error: backend did not answer within " + forwardTimeoutMs + "ms"
                : "Load balancer error: " + throwable.getMessage();
        log.warn("Forwarding failed: requestId={}, backendId={}, error={}",
                request.requestId(), backend.getId(), message);
        return ForwardResponse.error(request.requestId(), ErrorType.BALANCER_ERROR, message,
                backend.getId(), startTime);
    }

    private void completeWithError(ForwardRequestEvent event) {
        CompletableFuture<ForwardResponse> future = event.getResponseFuture();
        if (future == null) {
            return;
        }

        ErrorType errorType = event.getErrorType() != null ? event.getErrorType() : ErrorType.INTERNAL_ERROR;
        String requestId = event.getRequest() != null ? event.getRequest().requestId() : "unknown";
        Instant acceptedAt = event.getAcceptedAt() != null ? event.getAcceptedAt() : Instant.now();

        if (metricsRegistry != null) {
            metricsRegistry.incrementErrorCount(errorType);
        }
        log.warn("Completing request with pre-dispatch error: requestId={}, errorType={}, error={}",
                requestId, errorType, event.getErrorMessage());

        future.complete(ForwardResponse.error(requestId, errorType, event.getErrorMessage(), null, acceptedAt));
    }
}
