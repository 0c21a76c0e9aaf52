package dev.pekelund.spandana.auth;

import dev.pekelund.spandana.credentials.CredentialsConfiguration;
import dev.pekelund.spandana.messaging.SessionConfiguration;
import java.time.Clock;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Entry point of the sign-up and login screen.
 */
@SpringBootApplication
@Import({CredentialsConfiguration.class, SessionConfiguration.class})
@EnableConfigurationProperties(AuthProperties.class)
public class AuthApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
