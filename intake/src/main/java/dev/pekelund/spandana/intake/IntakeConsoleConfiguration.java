package dev.pekelund.spandana.intake;

import dev.pekelund.spandana.ledger.ComplaintLedger;
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
public class IntakeConsoleConfiguration {

    @Bean
    public ResponseValidator responseValidator() {
        return new ResponseValidator();
    }

    @Bean(destroyMethod = "")
    public PrintWriter consoleWriter() {
        return new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
    }

    @Bean
    public LedgerMaintenanceCommands ledgerMaintenanceCommands(ComplaintLedger complaintLedger,
        PrintWriter consoleWriter) {
        return new LedgerMaintenanceCommands(complaintLedger, consoleWriter);
    }

    @Bean
    @ConditionalOnProperty(prefix = "spandana.intake", name = "interactive", havingValue = "true",
        matchIfMissing = true)
    public ConsoleResponseSource consoleResponseSource(IntakeProperties properties) {
        return new ConsoleResponseSource(
            new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
            properties.getListenTimeout());
    }

    @Bean
    @ConditionalOnProperty(prefix = "spandana.intake", name = "interactive", havingValue = "true",
        matchIfMissing = true)
    public ConsoleAnnouncer consoleAnnouncer(IntakeProperties properties, PrintWriter consoleWriter) {
        return new ConsoleAnnouncer(consoleWriter, properties.getLanguage());
    }

    @Bean
    @ConditionalOnProperty(prefix = "spandana.intake", name = "interactive", havingValue = "true",
        matchIfMissing = true)
    public ApplicationRunner intakeRunner(
        LedgerMaintenanceCommands ledgerMaintenanceCommands,
        ResponseValidator responseValidator,
        ConsoleResponseSource consoleResponseSource,
        ConsoleAnnouncer consoleAnnouncer,
        ComplaintSubmissionService complaintSubmissionService
    ) {
        return args -> {
            if (!args.getNonOptionArgs().isEmpty()) {
                ledgerMaintenanceCommands.execute(args.getNonOptionArgs());
                return;
            }
            new IntakeConsole(responseValidator, consoleResponseSource, consoleAnnouncer,
                complaintSubmissionService).run();
            consoleAnnouncer.close();
        };
    }
}
