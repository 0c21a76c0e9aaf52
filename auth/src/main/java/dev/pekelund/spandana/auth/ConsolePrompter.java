package dev.pekelund.spandana.auth;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Line-based terminal used by the authentication screen.
 */
public class ConsolePrompter {

    private final BufferedReader in;
    private final PrintWriter out;

    public ConsolePrompter(BufferedReader in, PrintWriter out) {
        this.in = in;
        this.out = out;
    }

    /**
     * Print {@code label} and read one line.
     *
     * @return empty once the input is exhausted
     */
    public Optional<String> ask(String label) {
        out.print(label + ": ");
        out.flush();
        try {
            String line = in.readLine();
            return Optional.ofNullable(line).map(String::trim);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read from the console", ex);
        }
    }

    public void say(String message) {
        out.println(message);
        out.flush();
    }
}
