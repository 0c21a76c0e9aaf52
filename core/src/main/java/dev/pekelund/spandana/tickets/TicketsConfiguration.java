package dev.pekelund.spandana.tickets;

import dev.pekelund.spandana.ledger.ComplaintLedger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TicketProperties.class)
public class TicketsConfiguration {

    @Bean
    public TicketAllocator ticketAllocator(ComplaintLedger complaintLedger, TicketProperties properties) {
        return TicketAllocator.seededFrom(complaintLedger, properties);
    }
}
