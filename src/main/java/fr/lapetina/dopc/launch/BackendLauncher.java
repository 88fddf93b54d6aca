package fr.lapetina.dopc.launch;

import java.io.IOException;

/**
 * Starts pricing backends for the load balancer.
 */
public interface BackendLauncher {

    /**
     * Starts one backend listening on the given address.
     *
     * @throws IOException if the backend cannot be started
     */
    BackendHandle launch(String host, int port) throws IOException;

    String getName();
}
