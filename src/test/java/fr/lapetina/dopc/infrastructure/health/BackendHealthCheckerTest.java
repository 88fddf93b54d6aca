package fr.lapetina.dopc.infrastructure.health;

import fr.lapetina.dopc.domain.model.BackendInstance;
import fr.lapetina.dopc.domain.model.InstanceHealth;
import fr.lapetina.dopc.support.StubBackendHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class BackendHealthCheckerTest {

    private BackendRegistry registry;
    private StubBackendHttpClient httpClient;
    private BackendHealthChecker healthChecker;
    private BackendInstance first;
    private BackendInstance second;

    @BeforeEach
    void setUp() {
        registry = new BackendRegistry();
        httpClient = new StubBackendHttpClient();
        first = new BackendInstance("localhost", 8001);
        second = new BackendInstance("localhost", 8002);
        registry.register(first);
        registry.register(second);
        registry.markHealthy(first);
        registry.markHealthy(second);

        // Long interval: cycles are driven by the tests
        healthChecker = new BackendHealthChecker(registry, httpClient, Duration.ofMinutes(10), Duration.ofMillis(200));
    }

    @AfterEach
    void tearDown() {
        healthChecker.close();
    }

    @Test
    @DisplayName("should remove a backend that fails its probe")
    void shouldRemoveFailingBackend() {
        httpClient.down(second);

        healthChecker.checkBackend(second).join();

        assertThat(second.getHealth()).isEqualTo(InstanceHealth.UNHEALTHY);
        assertThat(registry.getHealthyBackends()).containsExactly(first);
        assertThat(second.getLastChecked()).isNotNull();
    }

    @Test
    @DisplayName("should restore a backend that recovers")
    void shouldRestoreRecoveredBackend() {
        httpClient.down(first);
        healthChecker.checkBackend(first).join();
        assertThat(registry.healthyCount()).isEqualTo(1);

        httpClient.up(first);
        healthChecker.checkBackend(first).join();

        assertThat(first.isHealthy()).isTrue();
        assertThat(registry.getHealthyBackends()).containsExactly(second, first);
    }

    @Test
    @DisplayName("should treat a probe that never answers as unhealthy")
    void shouldTreatSilentProbeAsUnhealthy() {
        BackendHealthChecker silent = new BackendHealthChecker(registry, new StubBackendHttpClient() {
            @Override
            public CompletableFuture<Boolean> healthCheck(BackendInstance backend) {
                return new CompletableFuture<>();
            }
        }, Duration.ofMinutes(10), Duration.ofMillis(100));

        silent.checkBackend(first).join();

        assertThat(first.getHealth()).isEqualTo(InstanceHealth.UNHEALTHY);
    }

    @Test
    @DisplayName("should probe every backend in a cycle once started")
    void shouldProbeEveryBackend() {
        Instant before = Instant.now();
        httpClient.down(first).down(second);

        healthChecker.start();
        healthChecker.checkAllBackends();

        assertThat(registry.healthyCount()).isZero();
        assertThat(first.getLastChecked()).isAfterOrEqualTo(before);
        assertThat(second.getLastChecked()).isAfterOrEqualTo(before);
    }

    @Test
    @DisplayName("should not probe before start")
    void shouldNotProbeBeforeStart() {
        httpClient.down(first);

        healthChecker.checkAllBackends();

        assertThat(first.isHealthy()).isTrue();
        assertThat(first.getLastChecked()).isNull();
    }
}
