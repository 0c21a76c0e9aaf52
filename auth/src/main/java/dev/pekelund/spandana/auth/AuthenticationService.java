package dev.pekelund.spandana.auth;

import dev.pekelund.spandana.credentials.CredentialRecord;
import dev.pekelund.spandana.credentials.CredentialStore;
import dev.pekelund.spandana.credentials.CredentialStoreException;
import dev.pekelund.spandana.credentials.DuplicateUsernameException;
import dev.pekelund.spandana.messaging.SessionHandoffStore;
import dev.pekelund.spandana.messaging.SessionRecord;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class AuthenticationService {

    static final String INVALID_CREDENTIALS = "Invalid username or password";
    static final String PASSWORD_MISMATCH = "Passwords do not match.";

    private static final Logger log = LoggerFactory.getLogger(AuthenticationService.class);

    private final CredentialStore credentialStore;
    private final SessionHandoffStore sessionStore;
    private final IntakeLauncher intakeLauncher;
    private final Validator validator;

    public AuthenticationService(
        CredentialStore credentialStore,
        SessionHandoffStore sessionStore,
        IntakeLauncher intakeLauncher,
        Validator validator
    ) {
        this.credentialStore = credentialStore;
        this.sessionStore = sessionStore;
        this.intakeLauncher = intakeLauncher;
        this.validator = validator;
    }

    public AuthenticationResult signUp(SignupForm form) {
        List<String> errors = validate(form);
        if (StringUtils.hasText(form.getConfirmPassword())
            && !Objects.equals(form.getPassword(), form.getConfirmPassword())) {
            errors.add(PASSWORD_MISMATCH);
        }
        if (!errors.isEmpty()) {
            return AuthenticationResult.rejected(errors);
        }

        CredentialRecord record;
        try {
            record = credentialStore.create(form.getUsername(), form.getPassword());
        } catch (DuplicateUsernameException ex) {
            return AuthenticationResult.rejected(ex.getMessage());
        } catch (CredentialStoreException ex) {
            log.error("Sign-up for '{}' failed", form.getUsername(), ex);
            return AuthenticationResult.rejected("Could not save your account: " + ex.getMessage());
        }

        log.info("Account '{}' created", record.username());
        return completeSession(record.username(), record.passwordHash());
    }

    public AuthenticationResult login(LoginForm form) {
        List<String> errors = validate(form);
        if (!errors.isEmpty()) {
            return AuthenticationResult.rejected(errors);
        }

        Optional<String> passwordHash;
        try {
            if (!credentialStore.verify(form.getUsername(), form.getPassword())) {
                log.info("Rejected login for '{}'", form.getUsername());
                return AuthenticationResult.rejected(INVALID_CREDENTIALS);
            }
            passwordHash = credentialStore.findPasswordHash(form.getUsername());
        } catch (CredentialStoreException ex) {
            log.error("Login for '{}' failed", form.getUsername(), ex);
            return AuthenticationResult.rejected("Could not read accounts: " + ex.getMessage());
        }

        if (passwordHash.isEmpty()) {
            return AuthenticationResult.rejected(INVALID_CREDENTIALS);
        }
        log.info("User '{}' logged in", form.getUsername());
        return completeSession(form.getUsername(), passwordHash.get());
    }

    private AuthenticationResult completeSession(String username, String passwordHash) {
        boolean sessionWritten = sessionStore.write(new SessionRecord(username, passwordHash));
        if (!sessionWritten) {
            log.warn("Continuing without a session file for '{}'", username);
        }
        boolean launched = intakeLauncher.launch();
        return AuthenticationResult.succeeded(username, sessionWritten, launched);
    }

    private <T> List<String> validate(T form) {
        List<String> errors = new ArrayList<>();
        validator.validate(form).stream()
            .sorted(Comparator.comparing((ConstraintViolation<T> violation) -> violation.getPropertyPath().toString())
                .thenComparing(ConstraintViolation::getMessage))
            .forEach(violation -> errors.add(violation.getMessage()));
        return errors;
    }
}
