package dev.pekelund.spandana.complaints;

/**
 * The five answers collected by the intake wizard.
 */
public record ComplaintDetails(
    String name,
    String mobileNumber,
    String location,
    String complaintType,
    String description
) {

    public ComplaintDetails {
        name = name != null ? name.trim() : "";
        mobileNumber = mobileNumber != null ? mobileNumber.trim() : "";
        location = location != null ? location.trim() : "";
        complaintType = complaintType != null ? complaintType.trim() : "";
        description = description != null ? description.trim() : "";
    }
}
