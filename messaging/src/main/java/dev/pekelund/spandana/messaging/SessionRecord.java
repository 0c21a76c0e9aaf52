package dev.pekelund.spandana.messaging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identity handed from the authentication screen to the intake screen. It is
 * overwritten on every login and never expires.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionRecord(
    @JsonProperty("username") String username,
    @JsonProperty("password_hash") String passwordHash
) {

    public SessionRecord {
        // Older session files may omit either key.
        username = username != null ? username : "";
        passwordHash = passwordHash != null ? passwordHash : "";
    }
}
