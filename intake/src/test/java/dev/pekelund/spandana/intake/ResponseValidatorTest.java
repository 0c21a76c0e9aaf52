package dev.pekelund.spandana.intake;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseValidatorTest {

    private final ResponseValidator validator = new ResponseValidator();

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\t"})
    void rejectsBlankAnswers(String response) {
        assertThat(validator.validate(IntakeField.NAME, response))
            .isEqualTo(FieldValidation.rejected("Please provide a response"));
    }

    @Test
    void rejectsMissingAnswer() {
        assertThat(validator.validate(IntakeField.LOCATION, null).valid()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"9876543210", "98765 43210", "+98765-43210", " 987-654-3210 "})
    void acceptsTenDigitMobileNumbersWithSeparators(String response) {
        assertThat(validator.validate(IntakeField.MOBILE_NUMBER, response).valid()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"98765abcde", "nine eight seven", "98765.43210"})
    void rejectsMobileNumbersWithLetters(String response) {
        assertThat(validator.validate(IntakeField.MOBILE_NUMBER, response))
            .isEqualTo(FieldValidation.rejected("Please enter a valid mobile number"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"987654321", "+91 98765 43210", "12345"})
    void rejectsMobileNumbersOfWrongLength(String response) {
        assertThat(validator.validate(IntakeField.MOBILE_NUMBER, response))
            .isEqualTo(FieldValidation.rejected("Mobile number should be 10 digits"));
    }

    @Test
    void otherFieldsOnlyNeedText() {
        assertThat(validator.validate(IntakeField.COMPLAINT_TYPE, "123").valid()).isTrue();
    }
}
