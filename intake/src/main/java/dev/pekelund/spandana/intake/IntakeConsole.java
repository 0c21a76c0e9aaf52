package dev.pekelund.spandana.intake;

import dev.pekelund.spandana.complaints.ComplaintTicket;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the intake wizard: ask the five questions, review the answers, submit,
 * then start over for the next complaint. Typing {@code back} re-asks the
 * previous question; {@code quit} or the end of input closes the desk.
 */
public class IntakeConsole {

    static final String REVIEW_OPTIONS =
        "Type 'submit' to file the complaint, 'edit <number>' to change an answer, or 'restart' to start over.";
    static final String NEXT_COMPLAINT = "Starting a new complaint. Type 'quit' to leave.";

    private static final Logger log = LoggerFactory.getLogger(IntakeConsole.class);

    private enum ReviewOutcome { DONE, RESTART, QUIT }

    private final IntakeConversation conversation;
    private final ResponseSource responses;
    private final Announcer announcer;
    private final ComplaintSubmissionService submissionService;

    public IntakeConsole(ResponseValidator validator, ResponseSource responses, Announcer announcer,
        ComplaintSubmissionService submissionService) {
        this.conversation = new IntakeConversation(validator);
        this.responses = responses;
        this.announcer = announcer;
        this.submissionService = submissionService;
    }

    public void run() {
        announcer.announce(IntakeConversation.WELCOME);
        if (!submissionService.currentIdentity().isAuthenticated()) {
            announcer.announce("No login was found; your complaint will be filed without an account.");
        }

        while (true) {
            conversation.reset();
            announcer.announce(conversation.currentPrompt());
            if (!collectAnswers()) {
                break;
            }
            ReviewOutcome outcome = review();
            if (outcome == ReviewOutcome.QUIT) {
                break;
            }
            announcer.announce(NEXT_COMPLAINT);
        }
        log.info("Intake session closed");
    }

    private boolean collectAnswers() {
        while (!conversation.isComplete()) {
            Optional<String> captured = responses.capture();
            if (responses.isExhausted() || isCommand(captured, "quit")) {
                return false;
            }
            if (isCommand(captured, "back")) {
                announcer.announce(conversation.clearLastResponse()
                    .orElse("No responses have been recorded yet. " + conversation.currentPrompt()));
                continue;
            }
            announcer.announce(conversation.accept(captured));
        }
        return true;
    }

    private ReviewOutcome review() {
        while (true) {
            announcer.announce(reviewText());
            announcer.announce(REVIEW_OPTIONS);

            Optional<String> captured = responses.capture();
            if (responses.isExhausted()) {
                return ReviewOutcome.QUIT;
            }
            if (captured.isEmpty() || captured.get().isEmpty()) {
                announcer.announce("Sorry, I didn't catch that.");
                continue;
            }

            String[] words = captured.get().trim().split("\\s+", 2);
            switch (words[0].toLowerCase(Locale.ROOT)) {
                case "submit" -> {
                    SubmissionResult result = submissionService.submit(conversation.toDetails());
                    announcer.announce(describe(result));
                    if (result.kind() == SubmissionResult.Kind.SUBMITTED
                        || result.kind() == SubmissionResult.Kind.DUPLICATE) {
                        return ReviewOutcome.DONE;
                    }
                }
                case "edit" -> {
                    Optional<IntakeField> field = words.length > 1 ? parseField(words[1]) : Optional.empty();
                    if (field.isEmpty()) {
                        announcer.announce("Please name a field number between 1 and " + IntakeField.values().length + ".");
                    } else if (!editField(field.get())) {
                        return ReviewOutcome.QUIT;
                    }
                }
                case "restart" -> {
                    return ReviewOutcome.RESTART;
                }
                case "quit" -> {
                    return ReviewOutcome.QUIT;
                }
                default -> announcer.announce("Unknown choice '" + captured.get() + "'.");
            }
        }
    }

    private boolean editField(IntakeField field) {
        announcer.announce(field.prompt());
        while (true) {
            Optional<String> captured = responses.capture();
            if (responses.isExhausted()) {
                return false;
            }
            if (captured.isEmpty() || captured.get().isEmpty()) {
                announcer.announce(IntakeConversation.NOT_CAUGHT + field.prompt());
                continue;
            }
            FieldValidation validation = conversation.edit(field, captured.get());
            if (validation.valid()) {
                announcer.announce(field.label() + " updated.");
                return true;
            }
            announcer.announce(validation.message() + ". " + field.prompt());
        }
    }

    private String reviewText() {
        StringBuilder text = new StringBuilder("Please review your complaint:");
        int number = 1;
        for (IntakeField field : IntakeField.values()) {
            String answer = conversation.answers().getOrDefault(field, "");
            text.append(System.lineSeparator()).append("  ").append(number++).append(". ")
                .append(field.label()).append(": ").append(answer);
        }
        return text.toString();
    }

    static String describe(SubmissionResult result) {
        return switch (result.kind()) {
            case SUBMITTED -> describeTicket(result.ticket());
            case DUPLICATE -> "You have already registered a complaint of this type. Your existing ticket ID is "
                + result.existingTicketId() + ". You cannot submit the same type of complaint again. "
                + "Please check the status of your existing complaint or choose a different complaint type.";
            case INCOMPLETE, FAILED -> result.message();
        };
    }

    private static String describeTicket(ComplaintTicket ticket) {
        String nl = System.lineSeparator();
        return "Your complaint has been successfully submitted!" + nl
            + "Your Ticket ID: " + ticket.ticketId() + nl
            + "Status: " + ticket.status() + nl
            + "Department: " + ticket.assignedDepartment().displayName() + nl
            + "Urgency: " + ticket.urgency().displayName() + nl
            + "Summary: " + ticket.summary() + nl
            + "Submitted: " + ticket.submittedAt() + nl
            + "Please note your Ticket ID for future reference.";
    }

    private static Optional<IntakeField> parseField(String value) {
        String trimmed = value.trim();
        IntakeField[] fields = IntakeField.values();
        try {
            int number = Integer.parseInt(trimmed);
            return number >= 1 && number <= fields.length ? Optional.of(fields[number - 1]) : Optional.empty();
        } catch (NumberFormatException ex) {
            for (IntakeField field : fields) {
                if (field.label().equalsIgnoreCase(trimmed)) {
                    return Optional.of(field);
                }
            }
            return Optional.empty();
        }
    }

    private static boolean isCommand(Optional<String> captured, String command) {
        return captured.map(value -> value.equalsIgnoreCase(command)).orElse(false);
    }

    Map<IntakeField, String> answers() {
        return conversation.answers();
    }
}
