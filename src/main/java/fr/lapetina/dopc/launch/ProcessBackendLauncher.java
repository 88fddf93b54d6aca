package fr.lapetina.dopc.launch;

import fr.lapetina.dopc.DopcApplication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs each backend as a child JVM executing {@code DopcApplication <config> instance <port>}.
 *
 * The child inherits the balancer's classpath and standard streams. A child that fails
 * to bind is not detected here; the health checker takes it out of rotation.
 */
public final class ProcessBackendLauncher implements BackendLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessBackendLauncher.class);

    private final String configPath;
    private final long startupDelayMs;

    public ProcessBackendLauncher(String configPath, long startupDelayMs) {
        this.configPath = configPath;
        this.startupDelayMs = startupDelayMs;
    }

    @Override
    public BackendHandle launch(String host, int port) throws IOException {
        Process process = new ProcessBuilder(command(port))
                .inheritIO()
                .start();
        log.info("Started backend process: pid={}, port={}", process.pid(), port);

        try {
            // Give the child time to bind before it is put in rotation
            Thread.sleep(startupDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while waiting for backend on port " + port + " to start", e);
        }

        if (!process.isAlive()) {
            throw new IOException("Backend process on port " + port + " exited with code " + process.exitValue());
        }
        return new ProcessHandle(process, port);
    }

    List<String> command(int port) {
        Path java = Paths.get(System.getProperty("java.home"), "bin", "java");
        return List.of(
                java.toString(),
                "-cp", System.getProperty("java.class.path"),
                DopcApplication.class.getName(),
                configPath,
                "instance",
                Integer.toString(port)
        );
    }

    @Override
    public String getName() {
        return "process";
    }

    private static final class ProcessHandle implements BackendHandle {
        private final Process process;
        private final int port;

        ProcessHandle(Process process, int port) {
            this.process = process;
            this.port = port;
        }

        @Override
        public int getPort() {
            return port;
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void close() {
            if (!process.isAlive()) {
                return;
            }
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    log.warn("Backend process did not stop, killing it: pid={}, port={}", process.pid(), port);
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
            }
            log.info("Backend process stopped: pid={}, port={}", process.pid(), port);
        }
    }
}
