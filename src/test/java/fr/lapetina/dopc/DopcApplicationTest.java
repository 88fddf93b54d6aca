package fr.lapetina.dopc;

import fr.lapetina.dopc.infrastructure.config.ConfigLoader;
import fr.lapetina.dopc.infrastructure.config.DopcConfig;
import fr.lapetina.dopc.launch.InProcessBackendLauncher;
import fr.lapetina.dopc.launch.ProcessBackendLauncher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DopcApplicationTest {

    @Test
    @DisplayName("should parse run modes case-insensitively")
    void shouldParseModes() {
        assertThat(DopcApplication.parseMode("balancer")).isEqualTo(DopcApplication.Mode.BALANCER);
        assertThat(DopcApplication.parseMode("INSTANCE")).isEqualTo(DopcApplication.Mode.INSTANCE);
        assertThatThrownBy(() -> DopcApplication.parseMode("worker"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should default the mode from the configuration")
    void shouldDefaultModeFromConfig() {
        DopcApplication app = new DopcApplication("test-config.yaml", null, null);

        assertThat(app.getMode()).isEqualTo(DopcApplication.Mode.BALANCER);
        assertThat(new DopcApplication("test-config.yaml", DopcApplication.Mode.INSTANCE, 0).getMode())
                .isEqualTo(DopcApplication.Mode.INSTANCE);
    }

    @Test
    @DisplayName("should pick the backend launcher from the launch mode")
    void shouldPickLauncher() {
        DopcConfig config = new ConfigLoader("test-config.yaml").load();
        assertThat(LoadBalancer.createLauncher(config, "test-config.yaml")).isInstanceOf(InProcessBackendLauncher.class);

        config.getBalancer().setLaunchMode("process");
        assertThat(LoadBalancer.createLauncher(config, "test-config.yaml")).isInstanceOf(ProcessBackendLauncher.class);

        config.getBalancer().setLaunchMode("docker");
        assertThatThrownBy(() -> LoadBalancer.createLauncher(config, "test-config.yaml"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
