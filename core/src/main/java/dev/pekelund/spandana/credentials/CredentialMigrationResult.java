package dev.pekelund.spandana.credentials;

import java.nio.file.Path;

/**
 * Outcome of bringing the credential file to the {@code username,password} layout.
 */
public record CredentialMigrationResult(
    Outcome outcome,
    Path backupFile,
    int migratedRows,
    String reason
) {

    public enum Outcome {
        /** The file did not exist or was empty and now holds the header only. */
        CREATED,
        NOT_NEEDED,
        MIGRATED,
        FAILED
    }

    public static CredentialMigrationResult created() {
        return new CredentialMigrationResult(Outcome.CREATED, null, 0, null);
    }

    public static CredentialMigrationResult notNeeded() {
        return new CredentialMigrationResult(Outcome.NOT_NEEDED, null, 0, null);
    }

    public static CredentialMigrationResult migrated(Path backupFile, int migratedRows) {
        return new CredentialMigrationResult(Outcome.MIGRATED, backupFile, migratedRows, null);
    }

    public static CredentialMigrationResult failed(String reason) {
        return new CredentialMigrationResult(Outcome.FAILED, null, 0,
            reason != null ? reason : "Unknown error");
    }

    public boolean isFailure() {
        return outcome == Outcome.FAILED;
    }
}
