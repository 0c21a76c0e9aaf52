package dev.pekelund.spandana.auth;

import java.util.List;

/**
 * Outcome of a login or sign-up attempt. A rejected attempt carries the messages
 * to show next to the form.
 */
public record AuthenticationResult(
    boolean success,
    String username,
    List<String> errors,
    boolean sessionWritten,
    boolean intakeLaunched
) {

    public AuthenticationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    static AuthenticationResult rejected(List<String> errors) {
        return new AuthenticationResult(false, null, errors, false, false);
    }

    static AuthenticationResult rejected(String error) {
        return rejected(List.of(error));
    }

    static AuthenticationResult succeeded(String username, boolean sessionWritten, boolean intakeLaunched) {
        return new AuthenticationResult(true, username, List.of(), sessionWritten, intakeLaunched);
    }
}
