package fr.lapetina.dopc.domain.event;

/**
 * Lifecycle state of a forward request event in the Disruptor pipeline.
 */
public enum EventState {
    /** Event just published, awaiting backend selection */
    CREATED,

    /** A healthy backend has been selected */
    BACKEND_SELECTED,

    /** The healthy set was empty */
    NO_BACKEND_AVAILABLE,

    /** Request relayed to the selected backend; the response arrives asynchronously */
    DISPATCHED,

    /** Request failed before dispatch */
    FAILED
}
