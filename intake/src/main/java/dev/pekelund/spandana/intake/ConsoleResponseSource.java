package dev.pekelund.spandana.intake;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Reads answers from a text stream on a background worker so that a silent user
 * times out instead of blocking the wizard. A line that arrives after its
 * timeout is returned by the next capture.
 */
public class ConsoleResponseSource implements ResponseSource, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConsoleResponseSource.class);

    private final BufferedReader reader;
    private final Duration timeout;
    private final ExecutorService worker =
        Executors.newSingleThreadExecutor(daemonThreads("intake-capture-"));

    private Future<String> pending;
    private volatile boolean exhausted;

    public ConsoleResponseSource(BufferedReader reader, Duration timeout) {
        this.reader = reader;
        this.timeout = timeout;
    }

    @Override
    public synchronized Optional<String> capture() {
        if (exhausted) {
            return Optional.empty();
        }
        if (pending == null) {
            pending = worker.submit(this::readLine);
        }

        try {
            String line = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            pending = null;
            if (line == null) {
                exhausted = true;
                return Optional.empty();
            }
            return Optional.of(line.trim());
        } catch (TimeoutException ex) {
            log.debug("No answer within {}", timeout);
            return Optional.empty();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            exhausted = true;
            return Optional.empty();
        } catch (ExecutionException ex) {
            pending = null;
            exhausted = true;
            log.error("Reading the console failed", ex.getCause());
            return Optional.empty();
        }
    }

    @Override
    public boolean isExhausted() {
        return exhausted;
    }

    @Override
    public void close() {
        worker.shutdownNow();
    }

    private String readLine() {
        try {
            return reader.readLine();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}
