package dev.pekelund.spandana.credentials;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CredentialProperties.class)
public class CredentialsConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CredentialsConfiguration.class);

    @Bean
    public GlobalSaltPasswordEncoder credentialPasswordEncoder(CredentialProperties properties) {
        return new GlobalSaltPasswordEncoder(properties.getGlobalSalt(), properties.getIterations());
    }

    @Bean
    public CsvCredentialStore credentialStore(
        CredentialProperties properties,
        GlobalSaltPasswordEncoder credentialPasswordEncoder,
        Clock clock
    ) {
        log.info("Using credential file {}", properties.getFile().toAbsolutePath());
        return new CsvCredentialStore(properties.getFile(), credentialPasswordEncoder, clock);
    }
}
