package dev.pekelund.spandana.intake;

import java.io.PrintWriter;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes announcements to the terminal from a single background worker, in the
 * order they were made. The language flag is passed along for speech output and
 * otherwise only logged.
 */
public class ConsoleAnnouncer implements Announcer, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConsoleAnnouncer.class);

    private final PrintWriter out;
    private final String language;
    private final ExecutorService worker =
        Executors.newSingleThreadExecutor(ConsoleResponseSource.daemonThreads("intake-announce-"));

    public ConsoleAnnouncer(PrintWriter out, String language) {
        this.out = out;
        this.language = language;
    }

    public String getLanguage() {
        return language;
    }

    @Override
    public void announce(String text) {
        worker.execute(() -> {
            log.debug("Announcing [{}]: {}", language, text);
            out.println(text);
            out.flush();
        });
    }

    /**
     * Let queued announcements finish, then stop the worker.
     */
    @Override
    public void close() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Dropping announcements still queued at shutdown");
                worker.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }
}
