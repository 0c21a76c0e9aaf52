package dev.pekelund.spandana.tickets;

import dev.pekelund.spandana.ledger.ComplaintLedger;
import java.util.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues ticket ids of the form {@code prefix + number} with strictly increasing
 * numbers. The counter is seeded once from the ids already on file and lives in
 * this process only; two processes allocating against the same ledger can issue
 * the same id.
 */
public class TicketAllocator {

    private static final Logger log = LoggerFactory.getLogger(TicketAllocator.class);

    private final String prefix;
    private long lastIssued;

    public TicketAllocator(String prefix, int start, Collection<String> existingTicketIds) {
        this.prefix = prefix;
        this.lastIssued = Math.max(start - 1L, highestNumber(prefix, existingTicketIds));
    }

    public static TicketAllocator seededFrom(ComplaintLedger ledger, TicketProperties properties) {
        TicketAllocator allocator = new TicketAllocator(properties.getPrefix(), properties.getStart(),
            ledger.ticketIds());
        log.info("Ticket allocator resumes after {}{}", properties.getPrefix(), allocator.lastIssued());
        return allocator;
    }

    public synchronized String next() {
        lastIssued++;
        return prefix + lastIssued;
    }

    public synchronized long lastIssued() {
        return lastIssued;
    }

    private static long highestNumber(String prefix, Collection<String> ticketIds) {
        long highest = 0;
        for (String ticketId : ticketIds) {
            if (ticketId == null) {
                continue;
            }
            String trimmed = ticketId.trim();
            if (!trimmed.startsWith(prefix)) {
                continue;
            }
            try {
                highest = Math.max(highest, Long.parseLong(trimmed.substring(prefix.length())));
            } catch (NumberFormatException ex) {
                log.debug("Ignoring ticket id {} with a non-numeric suffix", trimmed);
            }
        }
        return highest;
    }
}
