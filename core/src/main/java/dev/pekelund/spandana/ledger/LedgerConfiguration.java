package dev.pekelund.spandana.ledger;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LedgerConfiguration.class);

    @Bean
    public CsvComplaintLedger complaintLedger(LedgerProperties properties, Clock clock) {
        CsvComplaintLedger ledger = new CsvComplaintLedger(properties.getDirectory(), properties.getMasterFile(), clock);
        log.info("Using complaint ledger {}", ledger.getMasterFile().toAbsolutePath());
        return ledger;
    }
}
