package fr.lapetina.dopc.launch;

import fr.lapetina.dopc.PricingInstance;
import fr.lapetina.dopc.infrastructure.config.DopcConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Runs each backend as a {@link PricingInstance} inside the balancer's JVM,
 * with its own listener, upstream pool, admission gate and threads.
 */
public final class InProcessBackendLauncher implements BackendLauncher {

    private static final Logger log = LoggerFactory.getLogger(InProcessBackendLauncher.class);

    private final DopcConfig config;

    public InProcessBackendLauncher(DopcConfig config) {
        this.config = config;
    }

    @Override
    public BackendHandle launch(String host, int port) throws IOException {
        PricingInstance instance = PricingInstance.create(config, host, port).start();
        log.info("Started in-process backend: host={}, port={}", host, instance.getPort());
        return new InProcessHandle(instance);
    }

    @Override
    public String getName() {
        return "in-process";
    }

    private static final class InProcessHandle implements BackendHandle {
        private final PricingInstance instance;

        InProcessHandle(PricingInstance instance) {
            this.instance = instance;
        }

        @Override
        public int getPort() {
            return instance.getPort();
        }

        @Override
        public boolean isAlive() {
            return instance.isRunning();
        }

        @Override
        public void close() {
            instance.close();
        }
    }
}
