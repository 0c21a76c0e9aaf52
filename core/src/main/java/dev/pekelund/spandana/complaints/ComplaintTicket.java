package dev.pekelund.spandana.complaints;

/**
 * Confirmation handed back to the citizen once a complaint has been filed.
 */
public record ComplaintTicket(
    String ticketId,
    String citizenName,
    String location,
    String complaintCategory,
    UrgencyLevel urgency,
    String summary,
    Department assignedDepartment,
    String status,
    String submittedAt,
    String mobileNumber
) {

    private static final int SUMMARY_DESCRIPTION_LENGTH = 100;

    public static ComplaintTicket of(ComplaintRecord record, Classification classification) {
        return new ComplaintTicket(
            record.ticketId(),
            record.name(),
            record.location(),
            record.complaintType(),
            classification.urgency(),
            summarize(record.complaintType(), record.complaintDescription()),
            classification.department(),
            record.status(),
            record.createdAt(),
            record.mobileNumber());
    }

    static String summarize(String complaintType, String description) {
        String text = description != null ? description : "";
        if (text.length() > SUMMARY_DESCRIPTION_LENGTH) {
            text = text.substring(0, SUMMARY_DESCRIPTION_LENGTH) + "...";
        }
        return complaintType + ": " + text;
    }
}
