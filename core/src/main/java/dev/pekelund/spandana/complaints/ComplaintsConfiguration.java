package dev.pekelund.spandana.complaints;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ComplaintsConfiguration {

    @Bean
    public ComplaintClassifier complaintClassifier() {
        return ComplaintClassifier.withDefaultRules();
    }
}
