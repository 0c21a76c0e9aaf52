package dev.pekelund.spandana.intake;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "spandana.intake")
public class IntakeProperties {

    /**
     * How long to wait for an answer before asking again.
     */
    private Duration listenTimeout = Duration.ofSeconds(10);

    /**
     * Language flag handed to the announcer.
     */
    private String language = "te";

    /**
     * Whether the wizard or the maintenance commands run on startup.
     */
    private boolean interactive = true;

    public Duration getListenTimeout() {
        return listenTimeout;
    }

    public void setListenTimeout(Duration listenTimeout) {
        this.listenTimeout = listenTimeout;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public boolean isInteractive() {
        return interactive;
    }

    public void setInteractive(boolean interactive) {
        this.interactive = interactive;
    }
}
