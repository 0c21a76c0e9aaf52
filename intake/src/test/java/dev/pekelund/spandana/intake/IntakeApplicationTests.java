package dev.pekelund.spandana.intake;

import dev.pekelund.spandana.ledger.CsvComplaintLedger;
import dev.pekelund.spandana.tickets.TicketAllocator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "spandana.intake.interactive=false",
    "spandana.ledger.directory=target/intake-context-ledger",
    "spandana.session.file=target/intake-context-session.json"
})
class IntakeApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoadsWithoutStartingTheWizard() {
        assertThat(context.getBean(ComplaintSubmissionService.class)).isNotNull();
        assertThat(context.getBean(LedgerMaintenanceCommands.class)).isNotNull();
        assertThat(context.getBean(TicketAllocator.class).lastIssued()).isGreaterThanOrEqualTo(1000L);
        assertThat(context.getBean(CsvComplaintLedger.class).getMasterFile().toString()).endsWith("users_data.csv");
        assertThat(context.getBeansOfType(ConsoleResponseSource.class)).isEmpty();
    }
}
