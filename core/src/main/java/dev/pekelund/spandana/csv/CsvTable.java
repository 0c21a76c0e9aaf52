package dev.pekelund.spandana.csv;

import java.util.List;
import java.util.Locale;

/**
 * Header and data rows of a CSV file. Rows keep the width they had on disk, so
 * callers must use {@link #value(List, int)} to read cells that may be missing.
 */
public record CsvTable(List<String> header, List<List<String>> rows) {

    public CsvTable {
        header = header != null ? List.copyOf(header) : List.of();
        rows = rows != null ? List.copyOf(rows) : List.of();
    }

    public static CsvTable empty() {
        return new CsvTable(List.of(), List.of());
    }

    public boolean hasHeader() {
        return !header.isEmpty();
    }

    /**
     * Position of the first header cell equal to {@code column} after trimming, or -1.
     */
    public int indexOf(String column) {
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).trim().equals(column)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Like {@link #indexOf(String)} but ignores case.
     */
    public int indexOfIgnoreCase(String column) {
        String wanted = column.toLowerCase(Locale.ROOT);
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                return i;
            }
        }
        return -1;
    }

    public static String value(List<String> row, int index) {
        if (index < 0 || index >= row.size()) {
            return "";
        }
        String value = row.get(index);
        return value != null ? value : "";
    }
}
