package dev.pekelund.spandana.auth;

import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Starts the intake screen as an independent process. The authentication screen
 * does not wait for it.
 */
@Component
public class IntakeLauncher {

    private static final Logger log = LoggerFactory.getLogger(IntakeLauncher.class);

    private final List<String> command;

    public IntakeLauncher(AuthProperties properties) {
        this.command = List.copyOf(properties.getIntakeCommand());
    }

    public boolean isEnabled() {
        return !command.isEmpty();
    }

    /**
     * @return {@code true} when the process was started
     */
    public boolean launch() {
        if (!isEnabled()) {
            log.info("No intake command configured; not starting the intake screen");
            return false;
        }
        try {
            Process process = start(new ProcessBuilder(command).inheritIO());
            log.info("Started intake screen (pid {})", process.pid());
            return true;
        } catch (IOException ex) {
            log.error("Failed to start intake screen with {}", command, ex);
            return false;
        }
    }

    protected Process start(ProcessBuilder builder) throws IOException {
        return builder.start();
    }
}
