package dev.pekelund.spandana.ledger;

/**
 * Result of looking for an earlier complaint of the same type by the same account.
 */
public record DuplicateCheck(boolean duplicate, String existingTicketId) {

    private static final DuplicateCheck NONE = new DuplicateCheck(false, null);

    public static DuplicateCheck none() {
        return NONE;
    }

    public static DuplicateCheck found(String existingTicketId) {
        return new DuplicateCheck(true, existingTicketId);
    }
}
