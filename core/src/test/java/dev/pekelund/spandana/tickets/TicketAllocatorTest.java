package dev.pekelund.spandana.tickets;

import dev.pekelund.spandana.ledger.ComplaintLedger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TicketAllocatorTest {

    @Test
    void firstTicketOnEmptyLedgerUsesStartNumber() {
        TicketAllocator allocator = new TicketAllocator("TCKT", 1001, List.of());

        assertThat(allocator.next()).isEqualTo("TCKT1001");
        assertThat(allocator.next()).isEqualTo("TCKT1002");
    }

    @Test
    void resumesAfterHighestTicketOnFile() {
        TicketAllocator allocator = new TicketAllocator("TCKT", 1001,
            List.of("TCKT1004", "TCKT1010", " TCKT1007 ", "TCKTabc", "OTHER5000", ""));

        assertThat(allocator.next()).isEqualTo("TCKT1011");
    }

    @Test
    void lowNumbersOnFileDoNotPullTheCounterBelowStart() {
        TicketAllocator allocator = new TicketAllocator("TCKT", 1001, List.of("TCKT7", "TCKT12"));

        assertThat(allocator.next()).isEqualTo("TCKT1001");
    }

    @Test
    void idsAreUniqueAndStrictlyIncreasing() {
        TicketAllocator allocator = new TicketAllocator("TCKT", 1001, List.of("TCKT1500"));
        List<Long> numbers = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < 50; i++) {
            String id = allocator.next();
            ids.add(id);
            numbers.add(Long.parseLong(id.substring(4)));
        }

        assertThat(ids).hasSize(50);
        assertThat(numbers).isSorted().allMatch(number -> number > 1500);
    }

    @Test
    void seedsFromLedger() {
        ComplaintLedger ledger = mock(ComplaintLedger.class);
        when(ledger.ticketIds()).thenReturn(List.of("TCKT1001", "TCKT1002"));
        TicketProperties properties = new TicketProperties();

        TicketAllocator allocator = TicketAllocator.seededFrom(ledger, properties);

        assertThat(allocator.lastIssued()).isEqualTo(1002);
        assertThat(allocator.next()).isEqualTo("TCKT1003");
    }
}
