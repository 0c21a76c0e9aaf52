package dev.pekelund.spandana.complaints;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ComplaintTicketTest {

    @Test
    void summaryTruncatesLongDescriptions() {
        String description = "x".repeat(120);

        assertThat(ComplaintTicket.summarize("Water", description))
            .isEqualTo("Water: " + "x".repeat(100) + "...");
        assertThat(ComplaintTicket.summarize("Water", "No supply"))
            .isEqualTo("Water: No supply");
    }

    @Test
    void ticketCarriesTheClassificationAndRecordFields() {
        ComplaintRecord record = ComplaintRecord.open(
            new ComplaintIdentity("asha", "hash"),
            new ComplaintDetails("Asha", "9876543210", "Guntur", "Water", "No supply"),
            "TCKT1001",
            Department.WATER,
            "2026-03-01 09:30:00");

        ComplaintTicket ticket = ComplaintTicket.of(record,
            new Classification(Department.WATER, UrgencyLevel.MEDIUM));

        assertThat(ticket.ticketId()).isEqualTo("TCKT1001");
        assertThat(ticket.status()).isEqualTo("Open");
        assertThat(ticket.assignedDepartment()).isEqualTo(Department.WATER);
        assertThat(ticket.submittedAt()).isEqualTo("2026-03-01 09:30:00");
        assertThat(record.ticketAlive()).isEqualTo("Yes");
        assertThat(record.lastUpdatedAt()).isEqualTo(record.createdAt());
    }
}
