package dev.pekelund.spandana.complaints;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Local date-time format used by the {@code Timestamp} and {@code Last_Updated} columns.
 */
public final class ComplaintTimestamps {

    public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private ComplaintTimestamps() {
    }

    public static String now(Clock clock) {
        return FORMAT.format(LocalDateTime.now(clock));
    }

    public static Optional<LocalDateTime> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(value.trim(), FORMAT));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
