package dev.pekelund.spandana.intake;

import dev.pekelund.spandana.complaints.ComplaintTicket;

/**
 * Outcome of submitting a reviewed complaint.
 */
public record SubmissionResult(
    Kind kind,
    ComplaintTicket ticket,
    String existingTicketId,
    String message
) {

    public enum Kind {
        SUBMITTED,
        DUPLICATE,
        INCOMPLETE,
        FAILED
    }

    public static SubmissionResult submitted(ComplaintTicket ticket) {
        return new SubmissionResult(Kind.SUBMITTED, ticket, null, null);
    }

    public static SubmissionResult duplicate(String existingTicketId) {
        return new SubmissionResult(Kind.DUPLICATE, null, existingTicketId, null);
    }

    public static SubmissionResult incomplete(String message) {
        return new SubmissionResult(Kind.INCOMPLETE, null, null, message);
    }

    public static SubmissionResult failed(String message) {
        return new SubmissionResult(Kind.FAILED, null, null, message);
    }
}
