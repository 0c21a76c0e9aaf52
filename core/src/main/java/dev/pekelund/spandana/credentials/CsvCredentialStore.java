package dev.pekelund.spandana.credentials;

import dev.pekelund.spandana.csv.CsvFiles;
import dev.pekelund.spandana.csv.CsvTable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.util.StringUtils;

/**
 * Credential store backed by a two-column CSV file. Lookups are linear scans and
 * the first row with a matching username wins.
 */
public class CsvCredentialStore implements CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(CsvCredentialStore.class);

    static final List<String> HEADER = List.of("username", "password");

    private static final String USERNAME_COLUMN = "username";
    private static final String PASSWORD_COLUMN = "password";
    private static final String LEGACY_SALT_COLUMN = "salt";
    private static final String LEGACY_HASH_COLUMN = "pwd_hash";
    private static final List<String> LEGACY_HASH_COLUMNS = List.of(LEGACY_HASH_COLUMN, "hash", "pwdhash");

    private final Path file;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public CsvCredentialStore(Path file, PasswordEncoder passwordEncoder, Clock clock) {
        this.file = file;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public CredentialMigrationResult migrate() {
        try {
            if (Files.notExists(file)) {
                CsvFiles.rewrite(file, HEADER, List.of());
                log.info("Created credential file {}", file.toAbsolutePath());
                return CredentialMigrationResult.created();
            }

            CsvTable table = CsvFiles.read(file);
            if (!table.hasHeader()) {
                CsvFiles.rewrite(file, HEADER, List.of());
                log.info("Wrote missing header to empty credential file {}", file.toAbsolutePath());
                return CredentialMigrationResult.created();
            }

            if (!isLegacyLayout(table)) {
                return CredentialMigrationResult.notNeeded();
            }

            List<List<String>> migratedRows = new ArrayList<>(table.rows().size());
            for (CredentialRecord record : readLegacyRows(table)) {
                migratedRows.add(List.of(record.username(), record.passwordHash()));
            }

            Path backup = file.resolveSibling(file.getFileName() + ".bak." + clock.instant().getEpochSecond());
            Files.copy(file, backup, StandardCopyOption.COPY_ATTRIBUTES);
            CsvFiles.rewrite(file, HEADER, migratedRows);

            log.info("Migrated {} legacy credential rows in {}; original kept as {}",
                migratedRows.size(), file.toAbsolutePath(), backup.getFileName());
            return CredentialMigrationResult.migrated(backup, migratedRows.size());
        } catch (IOException | UncheckedIOException ex) {
            log.warn("Credential file {} could not be migrated and was left untouched", file.toAbsolutePath(), ex);
            return CredentialMigrationResult.failed(ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
    }

    @Override
    public boolean exists(String username) {
        return readAll().stream().anyMatch(record -> record.username().equals(username));
    }

    @Override
    public CredentialRecord create(String username, String password) {
        if (!StringUtils.hasText(username)) {
            throw new IllegalArgumentException("Username is required");
        }
        if (password == null) {
            throw new IllegalArgumentException("Password is required");
        }
        if (exists(username)) {
            throw new DuplicateUsernameException(username);
        }

        CredentialRecord record = new CredentialRecord(username, passwordEncoder.encode(password));
        try {
            if (Files.notExists(file)) {
                CsvFiles.rewrite(file, HEADER, List.of());
            }
            CsvFiles.append(file, List.of(record.username(), record.passwordHash()));
        } catch (IOException ex) {
            throw new CredentialStoreException("Can't write to " + file.getFileName()
                + ". Please check file permissions.", ex);
        }

        log.info("Created account {}", username);
        return record;
    }

    @Override
    public boolean verify(String username, String password) {
        return findPasswordHash(username)
            .map(stored -> passwordEncoder.matches(password, stored))
            .orElse(false);
    }

    @Override
    public Optional<String> findPasswordHash(String username) {
        return readAll().stream()
            .filter(record -> record.username().equals(username))
            .findFirst()
            .map(CredentialRecord::passwordHash);
    }

    List<CredentialRecord> readAll() {
        if (Files.notExists(file)) {
            return List.of();
        }

        CsvTable table;
        try {
            table = CsvFiles.read(file);
        } catch (IOException ex) {
            throw new CredentialStoreException("Failed to read credentials from " + file.getFileName(), ex);
        }
        if (!table.hasHeader()) {
            return List.of();
        }

        int usernameIndex = table.indexOfIgnoreCase(USERNAME_COLUMN);
        int passwordIndex = table.indexOfIgnoreCase(PASSWORD_COLUMN);
        if (usernameIndex >= 0 && passwordIndex >= 0) {
            List<CredentialRecord> records = new ArrayList<>(table.rows().size());
            for (List<String> row : table.rows()) {
                records.add(new CredentialRecord(
                    CsvTable.value(row, usernameIndex).trim(),
                    CsvTable.value(row, passwordIndex).trim()));
            }
            return records;
        }

        if (usernameIndex >= 0 && isLegacyLayout(table)) {
            return readLegacyRows(table);
        }

        // Unknown header: first column is the username, second the hash.
        List<CredentialRecord> records = new ArrayList<>(table.rows().size());
        for (List<String> row : table.rows()) {
            records.add(new CredentialRecord(CsvTable.value(row, 0).trim(), CsvTable.value(row, 1).trim()));
        }
        return records;
    }

    private static boolean isLegacyLayout(CsvTable table) {
        return table.indexOfIgnoreCase(LEGACY_SALT_COLUMN) >= 0
            || table.indexOfIgnoreCase(LEGACY_HASH_COLUMN) >= 0;
    }

    private static List<CredentialRecord> readLegacyRows(CsvTable table) {
        int usernameIndex = table.indexOfIgnoreCase(USERNAME_COLUMN);
        int saltIndex = table.indexOfIgnoreCase(LEGACY_SALT_COLUMN);
        int hashIndex = -1;
        for (String column : LEGACY_HASH_COLUMNS) {
            hashIndex = table.indexOfIgnoreCase(column);
            if (hashIndex >= 0) {
                break;
            }
        }

        List<CredentialRecord> records = new ArrayList<>(table.rows().size());
        for (List<String> row : table.rows()) {
            String salt = CsvTable.value(row, saltIndex).trim();
            String hash = CsvTable.value(row, hashIndex).trim();
            records.add(new CredentialRecord(
                CsvTable.value(row, usernameIndex).trim(),
                salt + GlobalSaltPasswordEncoder.LEGACY_SALT_SEPARATOR + hash));
        }
        return records;
    }
}
