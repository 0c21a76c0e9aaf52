package dev.pekelund.spandana.complaints;

/**
 * Row of a department ledger, a denormalised copy of a {@link ComplaintRecord}.
 */
public record DepartmentComplaintRecord(
    String ticketId,
    String username,
    String name,
    String mobileNumber,
    String location,
    String complaintType,
    String complaintDescription,
    String status,
    String urgencyLevel,
    String createdAt,
    String lastUpdatedAt
) {
}
