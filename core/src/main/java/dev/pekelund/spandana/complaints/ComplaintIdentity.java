package dev.pekelund.spandana.complaints;

import org.springframework.util.StringUtils;

/**
 * Account a complaint is filed under. Duplicate detection compares both values.
 */
public record ComplaintIdentity(String username, String passwordHash) {

    public static final String PLACEHOLDER = "N/A";

    public ComplaintIdentity {
        username = username != null ? username.trim() : "";
        passwordHash = passwordHash != null ? passwordHash.trim() : "";
    }

    /**
     * Identity recorded when the intake screen runs without a session.
     */
    public static ComplaintIdentity anonymous() {
        return new ComplaintIdentity(PLACEHOLDER, PLACEHOLDER);
    }

    public boolean isAuthenticated() {
        return StringUtils.hasText(username)
            && StringUtils.hasText(passwordHash)
            && !(PLACEHOLDER.equals(username) && PLACEHOLDER.equals(passwordHash));
    }
}
