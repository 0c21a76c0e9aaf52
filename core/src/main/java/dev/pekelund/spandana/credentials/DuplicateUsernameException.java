package dev.pekelund.spandana.credentials;

/**
 * Thrown when an account is created for a username that is already on file.
 */
public class DuplicateUsernameException extends CredentialStoreException {

    private final String username;

    public DuplicateUsernameException(String username) {
        super("Username already exists");
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
