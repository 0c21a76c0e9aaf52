package dev.pekelund.spandana.csv;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvException;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads and writes the flat CSV files shared by the authentication and intake
 * applications. Files are UTF-8 and fields are quoted only when they need it.
 */
public final class CsvFiles {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private CsvFiles() {
    }

    /**
     * Read the whole file. The first record is the header; an empty file yields
     * {@link CsvTable#empty()}.
     */
    public static CsvTable read(Path file) throws IOException {
        List<String[]> records;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader csvReader = new CSVReaderBuilder(reader)
                 .withCSVParser(new RFC4180ParserBuilder().build())
                 .build()) {
            records = csvReader.readAll();
        } catch (CsvException ex) {
            throw new IOException("Malformed CSV content in " + file, ex);
        }

        if (records.isEmpty()) {
            return CsvTable.empty();
        }

        List<String> header = new ArrayList<>(Arrays.asList(records.get(0)));
        if (!header.isEmpty() && !header.get(0).isEmpty() && header.get(0).charAt(0) == BYTE_ORDER_MARK) {
            header.set(0, header.get(0).substring(1));
        }

        List<List<String>> rows = new ArrayList<>(records.size() - 1);
        for (String[] record : records.subList(1, records.size())) {
            if (isBlankRecord(record)) {
                continue;
            }
            rows.add(Arrays.asList(record));
        }
        return new CsvTable(header, rows);
    }

    /**
     * Replace the file with the given header and rows. The content is written to a
     * temporary file in the same directory and moved over the target, so readers
     * never see a half-written file.
     */
    public static void rewrite(Path file, List<String> header, List<List<String>> rows) throws IOException {
        Path directory = parentOf(file);
        Files.createDirectories(directory);
        Path temporary = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(temporary, StandardCharsets.UTF_8);
                 ICSVWriter csvWriter = newWriter(writer)) {
                csvWriter.writeNext(header.toArray(String[]::new), false);
                for (List<String> row : rows) {
                    csvWriter.writeNext(row.toArray(String[]::new), false);
                }
            }
            moveIntoPlace(temporary, file);
        } finally {
            Files.deleteIfExists(temporary);
        }
    }

    /**
     * Append a single record to an existing file.
     */
    public static void append(Path file, List<String> row) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
             ICSVWriter csvWriter = newWriter(writer)) {
            csvWriter.writeNext(row.toArray(String[]::new), false);
        }
    }

    private static ICSVWriter newWriter(Writer writer) {
        return new CSVWriter(writer,
            ICSVWriter.DEFAULT_SEPARATOR,
            ICSVWriter.DEFAULT_QUOTE_CHARACTER,
            ICSVWriter.DEFAULT_ESCAPE_CHARACTER,
            ICSVWriter.DEFAULT_LINE_END);
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static Path parentOf(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        return parent != null ? parent : file.toAbsolutePath();
    }

    private static boolean isBlankRecord(String[] record) {
        return record.length == 0 || (record.length == 1 && record[0].isBlank());
    }
}
