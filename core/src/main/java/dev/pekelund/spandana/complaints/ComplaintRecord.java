package dev.pekelund.spandana.complaints;

/**
 * Row of the master ledger. {@code ticketId} is the key; status changes rewrite
 * {@code status} and {@code lastUpdatedAt} in place and keep no history.
 */
public record ComplaintRecord(
    String username,
    String passwordHash,
    String name,
    String mobileNumber,
    String location,
    String complaintType,
    String complaintDescription,
    String ticketId,
    String status,
    String ticketAlive,
    String createdAt,
    String lastUpdatedAt,
    String assignedDepartment
) {

    public static final String STATUS_OPEN = "Open";
    public static final String TICKET_ALIVE = "Yes";

    public static ComplaintRecord open(
        ComplaintIdentity identity,
        ComplaintDetails details,
        String ticketId,
        Department department,
        String timestamp
    ) {
        return new ComplaintRecord(
            identity.username(),
            identity.passwordHash(),
            details.name(),
            details.mobileNumber(),
            details.location(),
            details.complaintType(),
            details.description(),
            ticketId,
            STATUS_OPEN,
            TICKET_ALIVE,
            timestamp,
            timestamp,
            department.displayName());
    }

    /**
     * Copy of this record for the ledger of the assigned department.
     */
    public DepartmentComplaintRecord toDepartmentRecord(UrgencyLevel urgency) {
        return new DepartmentComplaintRecord(
            ticketId,
            username,
            name,
            mobileNumber,
            location,
            complaintType,
            complaintDescription,
            status,
            urgency.displayName(),
            createdAt,
            lastUpdatedAt);
    }

    public ComplaintHistory toHistory() {
        return new ComplaintHistory(ticketId, status, createdAt, lastUpdatedAt, complaintType,
            complaintDescription, assignedDepartment);
    }
}
