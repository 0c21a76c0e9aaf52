package dev.pekelund.spandana.csv;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

class CsvFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void quotesOnlyFieldsThatNeedIt() throws IOException {
        Path file = tempDir.resolve("ledger.csv");

        CsvFiles.rewrite(file, List.of("Name", "Location"), List.of(List.of("Ravi", "Ward 4, Guntur")));

        assertThat(Files.readString(file, StandardCharsets.UTF_8))
            .isEqualTo("Name,Location\nRavi,\"Ward 4, Guntur\"\n");
    }

    @Test
    void appendKeepsEarlierRows() throws IOException {
        Path file = tempDir.resolve("users.csv");
        CsvFiles.rewrite(file, List.of("username", "password"), List.of(List.of("asha", "abc")));

        CsvFiles.append(file, List.of("ravi", "def"));

        CsvTable table = CsvFiles.read(file);
        assertThat(table.header()).containsExactly("username", "password");
        assertThat(table.rows()).containsExactly(List.of("asha", "abc"), List.of("ravi", "def"));
    }

    @Test
    void readsFilesWrittenWithCarriageReturnsAndByteOrderMark() throws IOException {
        Path file = tempDir.resolve("users.csv");
        Files.writeString(file, "\uFEFFusername,password\r\nasha,abc\r\n\r\n", StandardCharsets.UTF_8);

        CsvTable table = CsvFiles.read(file);

        assertThat(table.indexOf("username")).isZero();
        assertThat(table.rows()).containsExactly(List.of("asha", "abc"));
    }

    @Test
    void backslashesAndQuotesSurviveARoundTrip() throws IOException {
        Path file = tempDir.resolve("ledger.csv");
        List<String> row = List.of("C:\\share\\docs", "pipe \"burst\" near school", "end");

        CsvFiles.rewrite(file, List.of("Path", "Description", "Tail"), List.of(row));
        CsvFiles.append(file, row);

        assertThat(CsvFiles.read(file).rows()).containsExactly(row, row);
    }

    @Test
    void emptyFileHasNoHeader() throws IOException {
        Path file = Files.createFile(tempDir.resolve("empty.csv"));

        assertThat(CsvFiles.read(file).hasHeader()).isFalse();
    }

    @Test
    void rewriteLeavesNoTemporaryFilesBehind() throws IOException {
        Path file = tempDir.resolve("users.csv");

        CsvFiles.rewrite(file, List.of("username", "password"), List.of());
        CsvFiles.rewrite(file, List.of("username", "password"), List.of(List.of("asha", "abc")));

        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    void missingCellsReadAsEmpty() {
        assertThat(CsvTable.value(List.of("a"), 3)).isEmpty();
        assertThat(CsvTable.value(List.of("a"), -1)).isEmpty();
    }
}
