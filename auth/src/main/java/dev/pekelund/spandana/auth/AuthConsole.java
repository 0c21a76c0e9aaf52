package dev.pekelund.spandana.auth;

import dev.pekelund.spandana.credentials.CredentialMigrationResult;
import dev.pekelund.spandana.credentials.CredentialStore;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The sign-up and login screen. Runs until a login or sign-up succeeds, the user
 * quits or the input ends.
 */
public class AuthConsole {

    private static final Logger log = LoggerFactory.getLogger(AuthConsole.class);

    private final CredentialStore credentialStore;
    private final AuthenticationService authenticationService;
    private final ConsolePrompter prompter;

    public AuthConsole(CredentialStore credentialStore, AuthenticationService authenticationService,
        ConsolePrompter prompter) {
        this.credentialStore = credentialStore;
        this.authenticationService = authenticationService;
        this.prompter = prompter;
    }

    /**
     * @return the successful result, or empty when the user left without logging in
     */
    public Optional<AuthenticationResult> run() {
        reportMigration(credentialStore.migrate());
        prompter.say("Welcome to SPANDANA. Type 'login', 'signup' or 'quit'.");

        while (true) {
            Optional<String> choice = prompter.ask("Choice");
            if (choice.isEmpty()) {
                return Optional.empty();
            }

            Optional<AuthenticationResult> result;
            switch (choice.get().toLowerCase(Locale.ROOT)) {
                case "login", "l" -> result = loginForm().map(authenticationService::login);
                case "signup", "sign-up", "s" -> result = signupForm().map(authenticationService::signUp);
                case "quit", "q", "exit" -> {
                    return Optional.empty();
                }
                default -> {
                    prompter.say("Please type 'login', 'signup' or 'quit'.");
                    continue;
                }
            }

            if (result.isEmpty()) {
                return Optional.empty();
            }
            if (result.get().success()) {
                announceSuccess(result.get());
                return result;
            }
            result.get().errors().forEach(error -> prompter.say("  " + error));
        }
    }

    private void reportMigration(CredentialMigrationResult migration) {
        switch (migration.outcome()) {
            case MIGRATED -> prompter.say("Migrated " + migration.migratedRows()
                + " accounts to the new password format. Backup: " + migration.backupFile().getFileName());
            case FAILED -> {
                log.warn("Credential migration failed: {}", migration.reason());
                prompter.say("Warning: could not migrate the account file (" + migration.reason() + ").");
            }
            default -> log.debug("Credential file check: {}", migration.outcome());
        }
    }

    private Optional<LoginForm> loginForm() {
        Optional<String> username = prompter.ask("Username");
        if (username.isEmpty()) {
            return Optional.empty();
        }
        return prompter.ask("Password").map(password -> new LoginForm(username.get(), password));
    }

    private Optional<SignupForm> signupForm() {
        Optional<String> username = prompter.ask("Username");
        if (username.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> password = prompter.ask("Password");
        if (password.isEmpty()) {
            return Optional.empty();
        }
        return prompter.ask("Confirm password")
            .map(confirm -> new SignupForm(username.get(), password.get(), confirm));
    }

    private void announceSuccess(AuthenticationResult result) {
        prompter.say("Welcome, " + result.username() + "!");
        if (!result.sessionWritten()) {
            prompter.say("Note: your session could not be saved; complaints will be filed without your account.");
        }
        if (result.intakeLaunched()) {
            prompter.say("Opening the complaint desk...");
        }
    }
}
