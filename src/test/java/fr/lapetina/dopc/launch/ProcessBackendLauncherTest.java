package fr.lapetina.dopc.launch;

import fr.lapetina.dopc.DopcApplication;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessBackendLauncherTest {

    @Test
    @DisplayName("should start a standalone instance on the given port")
    void shouldBuildInstanceCommand() {
        ProcessBackendLauncher launcher = new ProcessBackendLauncher("conf/config.yaml", 0);

        List<String> command = launcher.command(8002);

        assertThat(command.get(0)).endsWith("java");
        assertThat(command).containsSubsequence("-cp", System.getProperty("java.class.path"));
        assertThat(command.subList(command.size() - 4, command.size())).containsExactly(
                DopcApplication.class.getName(), "conf/config.yaml", "instance", "8002");
        assertThat(launcher.getName()).isEqualTo("process");
    }
}
