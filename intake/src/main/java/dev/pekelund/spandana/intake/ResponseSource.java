package dev.pekelund.spandana.intake;

import java.util.Optional;

/**
 * Where the wizard's answers come from.
 */
public interface ResponseSource {

    /**
     * Wait for one answer.
     *
     * @return the answer, or empty when nothing was captured in time
     */
    Optional<String> capture();

    /**
     * Whether the source has ended and will never produce another answer.
     */
    boolean isExhausted();
}
