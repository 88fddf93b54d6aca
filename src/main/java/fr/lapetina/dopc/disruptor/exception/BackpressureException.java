package fr.lapetina.dopc.disruptor.exception;

/**
 * Thrown when the forwarding ring buffer has no free slot for a new request.
 * Surfaces to clients as a 503.
 */
public final class BackpressureException extends RuntimeException {

    private final long remainingCapacity;

    public BackpressureException(long remainingCapacity) {
        super("Backpressure: ring buffer is full, remaining capacity: " + remainingCapacity);
        this.remainingCapacity = remainingCapacity;
    }

    public long getRemainingCapacity() {
        return remainingCapacity;
    }
}
