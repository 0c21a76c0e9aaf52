package dev.pekelund.spandana.intake;

/**
 * Questions asked by the intake wizard, in the order they are asked.
 */
public enum IntakeField {

    NAME("Name", "Please say your name."),
    MOBILE_NUMBER("Mobile Number", "Please say your mobile number."),
    LOCATION("Location", "Please say your location."),
    COMPLAINT_TYPE("Complaint Type", "What type of complaint do you have?"),
    COMPLAINT_DESCRIPTION("Complaint Description", "Please describe your complaint.");

    private final String label;
    private final String prompt;

    IntakeField(String label, String prompt) {
        this.label = label;
        this.prompt = prompt;
    }

    public String label() {
        return label;
    }

    public String prompt() {
        return prompt;
    }
}
