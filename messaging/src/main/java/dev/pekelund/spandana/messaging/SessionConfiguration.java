package dev.pekelund.spandana.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SessionProperties.class)
public class SessionConfiguration {

    @Bean
    public SessionHandoffStore sessionHandoffStore(SessionProperties properties) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return new SessionHandoffStore(properties, mapper, System.getenv());
    }
}
