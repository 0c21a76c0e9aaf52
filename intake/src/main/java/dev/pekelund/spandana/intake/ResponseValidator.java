package dev.pekelund.spandana.intake;

import org.springframework.util.StringUtils;

/**
 * Checks a single answer. Answers are stored as given; mobile numbers are only
 * cleaned for the check.
 */
public class ResponseValidator {

    static final String BLANK = "Please provide a response";
    static final String INVALID_MOBILE = "Please enter a valid mobile number";
    static final String MOBILE_LENGTH = "Mobile number should be 10 digits";

    private static final int MOBILE_DIGITS = 10;

    public FieldValidation validate(IntakeField field, String response) {
        if (!StringUtils.hasText(response)) {
            return FieldValidation.rejected(BLANK);
        }
        if (field == IntakeField.MOBILE_NUMBER) {
            return validateMobile(response);
        }
        return FieldValidation.accepted();
    }

    private static FieldValidation validateMobile(String response) {
        String cleaned = response.replace(" ", "").replace("-", "").replace("+", "");
        if (cleaned.isEmpty() || !cleaned.chars().allMatch(ch -> ch >= '0' && ch <= '9')) {
            return FieldValidation.rejected(INVALID_MOBILE);
        }
        if (cleaned.length() != MOBILE_DIGITS) {
            return FieldValidation.rejected(MOBILE_LENGTH);
        }
        return FieldValidation.accepted();
    }
}
