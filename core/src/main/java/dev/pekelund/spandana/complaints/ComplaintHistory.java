package dev.pekelund.spandana.complaints;

public record ComplaintHistory(
    String ticketId,
    String status,
    String created,
    String lastUpdated,
    String complaintType,
    String description,
    String department
) {
}
