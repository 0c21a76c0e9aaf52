package dev.pekelund.spandana.intake;

import dev.pekelund.spandana.complaints.ComplaintDetails;
import java.util.Optional;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntakeConversationTest {

    private final IntakeConversation conversation = new IntakeConversation(new ResponseValidator());

    @Test
    void asksFieldsInOrderAndCollectsAnswers() {
        assertThat(conversation.currentPrompt()).isEqualTo("Please say your name.");

        assertThat(conversation.accept(Optional.of("Asha"))).isEqualTo("Please say your mobile number.");
        assertThat(conversation.accept(Optional.of("98765 43210"))).isEqualTo("Please say your location.");
        assertThat(conversation.accept(Optional.of("Guntur"))).isEqualTo("What type of complaint do you have?");
        assertThat(conversation.accept(Optional.of("Water"))).isEqualTo("Please describe your complaint.");
        assertThat(conversation.accept(Optional.of("No water since Monday")))
            .isEqualTo(IntakeConversation.COMPLETED);

        assertThat(conversation.isComplete()).isTrue();
        assertThat(conversation.toDetails())
            .isEqualTo(new ComplaintDetails("Asha", "98765 43210", "Guntur", "Water", "No water since Monday"));
    }

    @Test
    void timeoutRepeatsQuestionWithoutAdvancing() {
        assertThat(conversation.accept(Optional.empty()))
            .isEqualTo("Sorry, I didn't catch that. Please say your name.");
        assertThat(conversation.accept(Optional.of("")))
            .isEqualTo("Sorry, I didn't catch that. Please say your name.");
        assertThat(conversation.currentField()).contains(IntakeField.NAME);
    }

    @Test
    void invalidAnswerRepeatsQuestionWithReason() {
        conversation.accept(Optional.of("Asha"));

        assertThat(conversation.accept(Optional.of("12345")))
            .isEqualTo("Mobile number should be 10 digits. Please say your mobile number.");
        assertThat(conversation.accept(Optional.of("  ")))
            .isEqualTo("Please provide a response. Please say your mobile number.");
        assertThat(conversation.currentField()).contains(IntakeField.MOBILE_NUMBER);
    }

    @Test
    void clearingLastResponseAsksItAgain() {
        assertThat(conversation.clearLastResponse()).isEmpty();
        conversation.accept(Optional.of("Asha"));

        assertThat(conversation.clearLastResponse()).contains("Please provide your answer again. Please say your name.");
        assertThat(conversation.answers()).isEmpty();
        assertThat(conversation.currentField()).contains(IntakeField.NAME);
    }

    @Test
    void editReplacesOnlyValidAnswers() {
        conversation.accept(Optional.of("Asha"));
        conversation.accept(Optional.of("9876543210"));

        assertThat(conversation.edit(IntakeField.MOBILE_NUMBER, "abc").valid()).isFalse();
        assertThat(conversation.answers()).containsEntry(IntakeField.MOBILE_NUMBER, "9876543210");

        assertThat(conversation.edit(IntakeField.MOBILE_NUMBER, "9123456789").valid()).isTrue();
        assertThat(conversation.answers()).containsEntry(IntakeField.MOBILE_NUMBER, "9123456789");
    }

    @Test
    void acceptingAfterCompletionIsAnError() {
        for (String answer : new String[] {"Asha", "9876543210", "Guntur", "Water", "Leak"}) {
            conversation.accept(Optional.of(answer));
        }

        assertThatThrownBy(() -> conversation.accept(Optional.of("extra")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void resetStartsOver() {
        conversation.accept(Optional.of("Asha"));

        conversation.reset();

        assertThat(conversation.answers()).isEmpty();
        assertThat(conversation.currentPrompt()).isEqualTo("Please say your name.");
    }
}
