package dev.pekelund.spandana.ledger;

/**
 * Signals that a ledger file could not be read or written.
 */
public class LedgerStorageException extends RuntimeException {

    public LedgerStorageException(String message) {
        super(message);
    }

    public LedgerStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
