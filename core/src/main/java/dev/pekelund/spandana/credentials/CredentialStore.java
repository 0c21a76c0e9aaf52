package dev.pekelund.spandana.credentials;

import java.util.Optional;

public interface CredentialStore {

    /**
     * Bring the backing file to the current layout. Called once when the
     * authentication screen opens; failures are reported, not thrown.
     */
    CredentialMigrationResult migrate();

    boolean exists(String username);

    /**
     * @throws DuplicateUsernameException when the username is already on file
     * @throws CredentialStoreException when the file cannot be written
     */
    CredentialRecord create(String username, String password);

    boolean verify(String username, String password);

    Optional<String> findPasswordHash(String username);
}
