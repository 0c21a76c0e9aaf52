package dev.pekelund.spandana.credentials;

/**
 * One row of the credential file. {@code passwordHash} is either a bare hex hash
 * or the legacy {@code salt_hex$hash_hex} form.
 */
public record CredentialRecord(String username, String passwordHash) {

    public CredentialRecord {
        username = username != null ? username : "";
        passwordHash = passwordHash != null ? passwordHash : "";
    }
}
