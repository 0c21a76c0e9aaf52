package dev.pekelund.spandana.messaging;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "spandana.session")
public class SessionProperties {

    /**
     * JSON file the authentication screen writes and the intake screen reads.
     */
    private Path file = Path.of("spandana_session.json");

    /**
     * Environment variable consulted for the username when the session file is absent.
     */
    private String usernameVariable = "SPANDANA_USERNAME";

    /**
     * Environment variable consulted for the password hash when the session file is absent.
     */
    private String passwordHashVariable = "SPANDANA_PASSWORD_HASH";

    public Path getFile() {
        return file;
    }

    public void setFile(Path file) {
        this.file = file;
    }

    public String getUsernameVariable() {
        return usernameVariable;
    }

    public void setUsernameVariable(String usernameVariable) {
        this.usernameVariable = usernameVariable;
    }

    public String getPasswordHashVariable() {
        return passwordHashVariable;
    }

    public void setPasswordHashVariable(String passwordHashVariable) {
        this.passwordHashVariable = passwordHashVariable;
    }
}
