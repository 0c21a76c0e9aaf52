package dev.pekelund.spandana.complaints;

import java.util.Locale;
import java.util.Objects;

/**
 * One row of an ordered classification table: when {@code keyword} occurs
 * anywhere in the inspected text, the rule yields {@code outcome}.
 */
public record KeywordRule<T>(String keyword, T outcome) {

    public KeywordRule {
        Objects.requireNonNull(keyword, "keyword must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        keyword = keyword.toLowerCase(Locale.ROOT);
    }

    public static <T> KeywordRule<T> of(String keyword, T outcome) {
        return new KeywordRule<>(keyword, outcome);
    }

    boolean matches(String lowerCaseText) {
        return lowerCaseText.contains(keyword);
    }
}
