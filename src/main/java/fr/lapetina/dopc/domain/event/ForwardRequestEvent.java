package fr.lapetina.dopc.domain.event;

import fr.lapetina.dopc.domain.model.BackendInstance;
import fr.lapetina.dopc.domain.model.ErrorType;
import fr.lapetina.dopc.domain.model.ForwardRequest;
import fr.lapetina.dopc.domain.model.ForwardResponse;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Mutable ring buffer slot carrying one forward request through the pipeline.
 *
 * Slots are reused: handlers must not keep a reference to the event once
 * {@code onEvent} returns. Anything an asynchronous callback needs is copied out first.
 */
public final class ForwardRequestEvent {

    private ForwardRequest request;
    private EventState state;
    private BackendInstance selectedBackend;
    private ErrorType errorType;
    private String errorMessage;

    private Instant acceptedAt;

    private CompletableFuture<ForwardResponse> responseFuture;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.request = null;
        this.state = null;
        this.selectedBackend = null;
        this.errorType = null;
        this.errorMessage = null;
        this.acceptedAt = null;
        this.responseFuture = null;
    }

    public void initialize(ForwardRequest request, CompletableFuture<ForwardResponse> responseFuture) {
        clear();
        this.request = request;
        this.responseFuture = responseFuture;
        this.state = EventState.CREATED;
        this.acceptedAt = Instant.now();
    }

    public ForwardRequest getRequest() {
        return request;
    }

    public EventState getState() {
        return state;
    }

    public BackendInstance getSelectedBackend() {
        return selectedBackend;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getAcceptedAt() {
        return acceptedAt;
    }

    public CompletableFuture<ForwardResponse> getResponseFuture() {
        return responseFuture;
    }

    public void selectBackend(BackendInstance backend) {
        this.selectedBackend = backend;
        this.state = EventState.BACKEND_SELECTED;
    }

    public void markNoBackend(String message) {
        this.state = EventState.NO_BACKEND_AVAILABLE;
        this.errorType = ErrorType.NO_HEALTHY_BACKENDS;
        this.errorMessage = message;
    }

    public void markDispatched() {
        this.state = EventState.DISPATCHED;
    }

    public void markFailed(ErrorType errorType, String message) {
        this.state = EventState.FAILED;
        this.errorType = errorType;
        this.errorMessage = message;
    }

    /**
     * True if the event must not be dispatched.
     */
    public boolean shouldSkip() {
        return state == EventState.NO_BACKEND_AVAILABLE || state == EventState.FAILED;
    }

    @Override
    public String toString() {
        return "ForwardRequestEvent{" +
                "requestId=" + (request != null ? request.requestId() : "null") +
                ", state=" + state +
                ", backend=" + (selectedBackend != null ? selectedBackend.getId() : "null") +
                '}';
    }
}
