package dev.pekelund.spandana.intake;

public record FieldValidation(boolean valid, String message) {

    private static final FieldValidation ACCEPTED = new FieldValidation(true, null);

    public static FieldValidation accepted() {
        return ACCEPTED;
    }

    public static FieldValidation rejected(String message) {
        return new FieldValidation(false, message);
    }
}
