package dev.pekelund.spandana.auth;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "spandana.auth")
public class AuthProperties {

    /**
     * Command started, without arguments, after a successful login or sign-up.
     * Leave empty to disable the launch.
     */
    private List<String> intakeCommand = new ArrayList<>();

    /**
     * Whether the console screen runs on startup.
     */
    private boolean interactive = true;

    public List<String> getIntakeCommand() {
        return intakeCommand;
    }

    public void setIntakeCommand(List<String> intakeCommand) {
        this.intakeCommand = intakeCommand;
    }

    public boolean isInteractive() {
        return interactive;
    }

    public void setInteractive(boolean interactive) {
        this.interactive = interactive;
    }
}
