package dev.pekelund.spandana.intake;

import dev.pekelund.spandana.complaints.ComplaintsConfiguration;
import dev.pekelund.spandana.ledger.LedgerConfiguration;
import dev.pekelund.spandana.messaging.SessionConfiguration;
import dev.pekelund.spandana.tickets.TicketsConfiguration;
import java.time.Clock;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Entry point of the complaint intake screen. Started without arguments it runs
 * the wizard; with arguments it runs one ledger maintenance command.
 */
@SpringBootApplication
@Import({ComplaintsConfiguration.class, LedgerConfiguration.class, TicketsConfiguration.class,
    SessionConfiguration.class})
@EnableConfigurationProperties(IntakeProperties.class)
public class IntakeApplication {

    public static void main(String[] args) {
        SpringApplication.run(IntakeApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
