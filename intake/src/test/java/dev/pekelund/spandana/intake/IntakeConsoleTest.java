package dev.pekelund.spandana.intake;

import dev.pekelund.spandana.complaints.ComplaintDetails;
import dev.pekelund.spandana.complaints.ComplaintIdentity;
import dev.pekelund.spandana.complaints.ComplaintTicket;
import dev.pekelund.spandana.complaints.Department;
import dev.pekelund.spandana.complaints.UrgencyLevel;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IntakeConsoleTest {

    private static final ComplaintTicket TICKET = new ComplaintTicket("TCKT1001", "Asha", "Guntur", "Water",
        UrgencyLevel.MEDIUM, "Water: Leak", Department.WATER, "Open", "2026-03-01 09:30:00", "9876543210");

    private ComplaintSubmissionService submissionService;
    private ScriptedResponses responses;
    private final List<String> announced = new ArrayList<>();

    @BeforeEach
    void setUp() {
        submissionService = mock(ComplaintSubmissionService.class);
        when(submissionService.currentIdentity()).thenReturn(new ComplaintIdentity("asha", "cafe01"));
        when(submissionService.submit(any())).thenReturn(SubmissionResult.submitted(TICKET));
        responses = new ScriptedResponses();
    }

    @Test
    void walksThroughQuestionsReprompingOnTimeoutAndInvalidAnswers() {
        responses.timeout().say("Asha", "123", "9876543210", "Guntur", "Water", "Leak", "submit");

        console().run();

        verify(submissionService).submit(new ComplaintDetails("Asha", "9876543210", "Guntur", "Water", "Leak"));
        assertThat(announced).startsWith(IntakeConversation.WELCOME, "Please say your name.",
            "Sorry, I didn't catch that. Please say your name.", "Please say your mobile number.",
            "Mobile number should be 10 digits. Please say your mobile number.");
        assertThat(announced).contains(IntakeConversation.COMPLETED, IntakeConsole.NEXT_COMPLAINT);
        assertThat(String.join("\n", announced)).contains("Your Ticket ID: TCKT1001").contains("Urgency: Medium");
    }

    @Test
    void reviewCanEditAnAnswerBeforeSubmitting() {
        responses.say("Asha", "9876543210", "Guntur", "Water", "Leak", "edit 3", " ", "Vijayawada", "submit");

        console().run();

        verify(submissionService).submit(new ComplaintDetails("Asha", "9876543210", "Vijayawada", "Water", "Leak"));
        assertThat(announced).contains("Sorry, I didn't catch that. Please say your location.", "Location updated.");
    }

    @Test
    void backCommandReasksPreviousQuestion() {
        responses.say("Asha", "back", "Ravi", "9876543210", "Guntur", "Water", "Leak", "submit");

        console().run();

        verify(submissionService).submit(new ComplaintDetails("Ravi", "9876543210", "Guntur", "Water", "Leak"));
        assertThat(announced).contains("Please provide your answer again. Please say your name.");
    }

    @Test
    void duplicateIsExplainedAndNextComplaintStarts() {
        when(submissionService.submit(any())).thenReturn(SubmissionResult.duplicate("TCKT1002"));
        responses.say("Asha", "9876543210", "Guntur", "Water", "Leak", "submit");

        console().run();

        assertThat(announced).anySatisfy(message -> assertThat(message)
            .startsWith("You have already registered a complaint of this type. Your existing ticket ID is TCKT1002."));
        assertThat(announced).contains(IntakeConsole.NEXT_COMPLAINT);
    }

    @Test
    void failedSubmissionStaysInReview() {
        when(submissionService.submit(any()))
            .thenReturn(SubmissionResult.failed("Failed to save complaint data. Please try again."));
        responses.say("Asha", "9876543210", "Guntur", "Water", "Leak", "submit", "quit");

        console().run();

        verify(submissionService, times(1)).submit(any());
        assertThat(announced).contains("Failed to save complaint data. Please try again.")
            .doesNotContain(IntakeConsole.NEXT_COMPLAINT);
    }

    @Test
    void restartDiscardsAnswers() {
        responses.say("Asha", "9876543210", "Guntur", "Water", "Leak", "restart", "quit");

        console().run();

        verify(submissionService, never()).submit(any());
        assertThat(announced.stream().filter("Please say your name."::equals)).hasSize(2);
    }

    @Test
    void warnsWhenNoSessionIdentityExists() {
        when(submissionService.currentIdentity()).thenReturn(ComplaintIdentity.anonymous());

        console().run();

        assertThat(announced).contains("No login was found; your complaint will be filed without an account.");
    }

    private IntakeConsole console() {
        return new IntakeConsole(new ResponseValidator(), responses, announced::add, submissionService);
    }

    private static final class ScriptedResponses implements ResponseSource {

        private final Deque<Optional<String>> script = new ArrayDeque<>();
        private boolean exhausted;

        ScriptedResponses say(String... lines) {
            for (String line : lines) {
                script.add(Optional.of(line.trim()));
            }
            return this;
        }

        ScriptedResponses timeout() {
            script.add(Optional.empty());
            return this;
        }

        @Override
        public Optional<String> capture() {
            if (script.isEmpty()) {
                exhausted = true;
                return Optional.empty();
            }
            return script.poll();
        }

        @Override
        public boolean isExhausted() {
            return exhausted;
        }
    }
}
