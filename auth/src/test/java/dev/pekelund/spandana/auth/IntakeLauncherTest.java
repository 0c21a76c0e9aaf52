package dev.pekelund.spandana.auth;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class IntakeLauncherTest {

    @Test
    void emptyCommandDisablesLaunch() {
        IntakeLauncher launcher = new IntakeLauncher(new AuthProperties());

        assertThat(launcher.isEnabled()).isFalse();
        assertThat(launcher.launch()).isFalse();
    }

    @Test
    void startsConfiguredCommandWithoutArguments() {
        AuthProperties properties = new AuthProperties();
        properties.setIntakeCommand(List.of("java", "-jar", "intake.jar"));
        AtomicReference<List<String>> started = new AtomicReference<>();
        IntakeLauncher launcher = new IntakeLauncher(properties) {
            @Override
            protected Process start(ProcessBuilder builder) {
                started.set(builder.command());
                return mock(Process.class);
            }
        };

        assertThat(launcher.launch()).isTrue();
        assertThat(started.get()).containsExactly("java", "-jar", "intake.jar");
    }

    @Test
    void startFailureIsReportedNotThrown() {
        AuthProperties properties = new AuthProperties();
        properties.setIntakeCommand(List.of("missing-intake-binary"));
        IntakeLauncher launcher = new IntakeLauncher(properties) {
            @Override
            protected Process start(ProcessBuilder builder) throws IOException {
                throw new IOException("No such file");
            }
        };

        assertThat(launcher.launch()).isFalse();
    }
}
