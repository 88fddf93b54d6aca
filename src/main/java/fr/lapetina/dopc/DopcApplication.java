package fr.lapetina.dopc;

import fr.lapetina.dopc.api.BalancerHttpServer;
import fr.lapetina.dopc.infrastructure.config.ConfigLoader;
import fr.lapetina.dopc.infrastructure.config.DopcConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point of the Delivery Order Price Calculator.
 *
 * <pre>
 * DopcApplication [configPath] [balancer|instance] [port]
 * </pre>
 *
 * Without a mode, {@code general.useBalancer} decides. The balancer listens on
 * {@code general.port}; a standalone instance on the given port or {@code general.port}.
 */
public class DopcApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DopcApplication.class);

    public enum Mode { BALANCER, INSTANCE }

    private final DopcConfig config;
    private final Mode mode;
    private final int port;
    private final String configPath;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    private LoadBalancer loadBalancer;
    private BalancerHttpServer balancerServer;
    private PricingInstance instance;

    public DopcApplication(String configPath, Mode mode, Integer port) {
        this.configPath = configPath;
        this.config = new ConfigLoader(configPath).load();
        this.mode = mode != null ? mode : (config.getGeneral().isUseBalancer() ? Mode.BALANCER : Mode.INSTANCE);
        this.port = port != null ? port : config.getGeneral().getPort();
        log.info("DOPC initialized: mode={}, port={}, upstream={}",
                this.mode, this.port, config.getUpstream().effectiveBaseUrl());
    }

    /**
     * Starts the configured mode.
     *
     * @throws IOException if a listener cannot be bound
     */
    public void start() throws IOException {
        if (mode == Mode.BALANCER) {
            loadBalancer = LoadBalancer.create(config, configPath).start();
            balancerServer = new BalancerHttpServer(config.getGeneral().getHost(), port, config, loadBalancer);
            balancerServer.start();
            log.info("DOPC load balancer started on port {}", balancerServer.getPort());
        } else {
            instance = PricingInstance.create(config, config.getGeneral().getHost(), port).start();
            log.info("DOPC service started on port {}", instance.getPort());
        }
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public Mode getMode() {
        return mode;
    }

    public DopcConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        log.info("Shutting down DOPC...");

        if (balancerServer != null) {
            try {
                balancerServer.close();
            } catch (Exception e) {
                log.warn("Error closing balancer listener", e);
            }
        }

        if (loadBalancer != null) {
            try {
                loadBalancer.close();
            } catch (Exception e) {
                log.warn("Error closing load balancer", e);
            }
        }

        if (instance != null) {
            try {
                instance.close();
            } catch (Exception e) {
                log.warn("Error closing pricing instance", e);
            }
        }

        log.info("DOPC shut down");
    }

    static Mode parseMode(String value) {
        return switch (value.toLowerCase()) {
            case "balancer" -> Mode.BALANCER;
            case "instance" -> Mode.INSTANCE;
            default -> throw new IllegalArgumentException("Unknown mode '" + value + "', expected balancer or instance");
        };
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            Mode mode = args.length > 1 ? parseMode(args[1]) : null;
            Integer port = args.length > 2 ? Integer.valueOf(args[2]) : null;

            DopcApplication app = new DopcApplication(configPath, mode, port);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start DOPC", e);
            System.exit(1);
        }
    }
}
