package dev.pekelund.spandana.auth;

import dev.pekelund.spandana.credentials.CredentialStore;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "spandana.auth", name = "interactive", havingValue = "true", matchIfMissing = true)
public class AuthConsoleConfiguration {

    @Bean
    public ConsolePrompter consolePrompter() {
        return new ConsolePrompter(
            new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
            new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true));
    }

    @Bean
    public AuthConsole authConsole(CredentialStore credentialStore, AuthenticationService authenticationService,
        ConsolePrompter consolePrompter) {
        return new AuthConsole(credentialStore, authenticationService, consolePrompter);
    }

    @Bean
    public ApplicationRunner authConsoleRunner(AuthConsole authConsole) {
        return args -> authConsole.run();
    }
}
