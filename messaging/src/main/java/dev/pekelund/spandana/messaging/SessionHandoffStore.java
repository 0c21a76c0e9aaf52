package dev.pekelund.spandana.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Passes the logged-in identity between the two console processes through a
 * JSON file, falling back to a pair of environment variables.
 */
public class SessionHandoffStore {

    private static final Logger log = LoggerFactory.getLogger(SessionHandoffStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, String> environment;
    private final String usernameVariable;
    private final String passwordHashVariable;

    public SessionHandoffStore(SessionProperties properties, ObjectMapper objectMapper,
        Map<String, String> environment) {
        this.file = properties.getFile();
        this.objectMapper = objectMapper;
        this.environment = environment;
        this.usernameVariable = properties.getUsernameVariable();
        this.passwordHashVariable = properties.getPasswordHashVariable();
    }

    public Path getFile() {
        return file;
    }

    /**
     * Replace the session file with {@code session}.
     *
     * @return {@code false} when the file could not be written
     */
    public boolean write(SessionRecord session) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(file.toFile(), session);
            log.info("Session for '{}' written to {}", session.username(), file);
            return true;
        } catch (IOException ex) {
            log.error("Failed to write session file {}", file.toAbsolutePath(), ex);
            return false;
        }
    }

    public Optional<SessionRecord> read() {
        Optional<SessionRecord> fromFile = readFile();
        if (fromFile.isPresent()) {
            return fromFile;
        }

        String username = environment.get(usernameVariable);
        String passwordHash = environment.get(passwordHashVariable);
        if (StringUtils.hasText(username) && StringUtils.hasText(passwordHash)) {
            log.info("Using session identity from {}", usernameVariable);
            return Optional.of(new SessionRecord(username, passwordHash));
        }
        return Optional.empty();
    }

    private Optional<SessionRecord> readFile() {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            SessionRecord session = objectMapper.readValue(file.toFile(), SessionRecord.class);
            if (session == null || !StringUtils.hasText(session.username())) {
                log.warn("Session file {} holds no username; ignoring it", file);
                return Optional.empty();
            }
            return Optional.of(session);
        } catch (IOException ex) {
            log.warn("Could not read session file {}: {}", file, ex.getMessage());
            return Optional.empty();
        }
    }
}
