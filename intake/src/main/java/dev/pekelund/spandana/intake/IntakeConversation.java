package dev.pekelund.spandana.intake;

import dev.pekelund.spandana.complaints.ComplaintDetails;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * State of one run through the intake wizard: the answers given so far and the
 * question currently being asked. Each method returns the text to announce next.
 */
public class IntakeConversation {

    static final String WELCOME =
        "Hello! I am your complaint assistant chatbot. I'll ask you a few questions to file your complaint.";
    static final String COMPLETED = "Thank you! Your complaint has been recorded. Please review it before submitting.";
    static final String NOT_CAUGHT = "Sorry, I didn't catch that. ";

    private static final IntakeField[] FIELDS = IntakeField.values();

    private final ResponseValidator validator;
    private final Map<IntakeField, String> answers = new EnumMap<>(IntakeField.class);
    private int currentIndex;

    public IntakeConversation(ResponseValidator validator) {
        this.validator = validator;
    }

    public boolean isComplete() {
        return currentIndex >= FIELDS.length;
    }

    public Optional<IntakeField> currentField() {
        return isComplete() ? Optional.empty() : Optional.of(FIELDS[currentIndex]);
    }

    public String currentPrompt() {
        return currentField().map(IntakeField::prompt).orElse(COMPLETED);
    }

    /**
     * Record a captured answer for the current question. An empty capture, such
     * as a listen timeout, repeats the question.
     */
    public String accept(Optional<String> captured) {
        IntakeField field = currentField()
            .orElseThrow(() -> new IllegalStateException("All questions have been answered"));
        if (captured.isEmpty() || captured.get().isEmpty()) {
            return NOT_CAUGHT + field.prompt();
        }

        String response = captured.get();
        FieldValidation validation = validator.validate(field, response);
        if (!validation.valid()) {
            return validation.message() + ". " + field.prompt();
        }

        answers.put(field, response.trim());
        currentIndex++;
        return currentPrompt();
    }

    /**
     * Forget the most recent answer and ask that question again.
     */
    public Optional<String> clearLastResponse() {
        if (currentIndex == 0) {
            return Optional.empty();
        }
        currentIndex--;
        IntakeField field = FIELDS[currentIndex];
        answers.remove(field);
        return Optional.of("Please provide your answer again. " + field.prompt());
    }

    /**
     * Replace a single answer during review.
     */
    public FieldValidation edit(IntakeField field, String response) {
        FieldValidation validation = validator.validate(field, response);
        if (validation.valid()) {
            answers.put(field, response.trim());
        }
        return validation;
    }

    public void reset() {
        answers.clear();
        currentIndex = 0;
    }

    public Map<IntakeField, String> answers() {
        return Collections.unmodifiableMap(answers);
    }

    public ComplaintDetails toDetails() {
        return new ComplaintDetails(
            answers.get(IntakeField.NAME),
            answers.get(IntakeField.MOBILE_NUMBER),
            answers.get(IntakeField.LOCATION),
            answers.get(IntakeField.COMPLAINT_TYPE),
            answers.get(IntakeField.COMPLAINT_DESCRIPTION));
    }
}
