package dev.pekelund.spandana.ledger;

import dev.pekelund.spandana.complaints.ComplaintTimestamps;
import dev.pekelund.spandana.csv.CsvFiles;
import dev.pekelund.spandana.csv.CsvTable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a ledger file on its canonical header. Files written by older releases
 * are re-mapped column by column; this is a one-off rewrite, not a versioned
 * migration log.
 */
class LedgerSchema {

    private static final Logger log = LoggerFactory.getLogger(LedgerSchema.class);

    private final Clock clock;

    LedgerSchema(Clock clock) {
        this.clock = clock;
    }

    /**
     * Create {@code file} with {@code header}, or rewrite it so that its header
     * equals {@code header}, and return the rows in canonical column order.
     */
    List<List<String>> ensureHeader(Path file, List<String> header) throws IOException {
        if (Files.notExists(file)) {
            CsvFiles.rewrite(file, header, List.of());
            log.info("Created ledger file {}", file.toAbsolutePath());
            return List.of();
        }

        CsvTable table = CsvFiles.read(file);
        if (!table.hasHeader()) {
            CsvFiles.rewrite(file, header, List.of());
            return List.of();
        }

        if (table.header().equals(header)) {
            return padded(table.rows(), header.size());
        }

        List<List<String>> normalized = new ArrayList<>(table.rows().size());
        for (List<String> row : table.rows()) {
            normalized.add(normalizeRow(table, row, header));
        }
        CsvFiles.rewrite(file, header, normalized);
        log.info("Normalised ledger {} from {} to {} columns ({} rows)",
            file.getFileName(), table.header().size(), header.size(), normalized.size());
        return normalized;
    }

    private List<String> normalizeRow(CsvTable table, List<String> row, List<String> header) {
        List<String> normalized = new ArrayList<>(header.size());
        for (String column : header) {
            normalized.add(CsvTable.value(row, table.indexOf(column)));
        }

        int lastUpdatedIndex = header.indexOf(LedgerColumns.LAST_UPDATED);
        if (lastUpdatedIndex >= 0 && normalized.get(lastUpdatedIndex).isBlank()) {
            String created = CsvTable.value(row, table.indexOf(LedgerColumns.TIMESTAMP));
            normalized.set(lastUpdatedIndex, created.isBlank() ? ComplaintTimestamps.now(clock) : created);
        }
        return normalized;
    }

    private static List<List<String>> padded(List<List<String>> rows, int width) {
        List<List<String>> result = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<String> copy = new ArrayList<>(width);
            for (int i = 0; i < width; i++) {
                copy.add(CsvTable.value(row, i));
            }
            result.add(copy);
        }
        return result;
    }
}
