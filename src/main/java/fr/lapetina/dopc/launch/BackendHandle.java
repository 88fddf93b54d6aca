package fr.lapetina.dopc.launch;

/**
 * A running backend started by a {@link BackendLauncher}.
 */
public interface BackendHandle extends AutoCloseable {

    int getPort();

    boolean isAlive();

    /**
     * Terminates the backend. Idempotent, never throws.
     */
    @Override
    void close();
}
