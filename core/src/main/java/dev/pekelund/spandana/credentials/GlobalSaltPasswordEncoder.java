package dev.pekelund.spandana.credentials;

import org.springframework.security.crypto.codec.Hex;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder.SecretKeyFactoryAlgorithm;
import org.springframework.util.StringUtils;

/**
 * PBKDF2-HMAC-SHA256 password encoder for the credential file.
 *
 * <p>New hashes use one configured salt for every account and are stored as bare
 * lower-case hex. Older accounts were stored as {@code salt_hex$hash_hex}; those
 * are verified against their own salt with the same iteration count.
 */
public class GlobalSaltPasswordEncoder implements PasswordEncoder {

    public static final int DEFAULT_ITERATIONS = 200_000;
    public static final int MINIMUM_ITERATIONS = 100_000;

    static final char LEGACY_SALT_SEPARATOR = '$';

    private static final SecretKeyFactoryAlgorithm ALGORITHM = SecretKeyFactoryAlgorithm.PBKDF2WithHmacSHA256;

    // The global salt is passed as the encoder secret with no random salt, so the
    // derivation salt is exactly the configured value.
    private final Pbkdf2PasswordEncoder globalEncoder;
    private final int iterations;

    public GlobalSaltPasswordEncoder(String globalSalt, int iterations) {
        if (!StringUtils.hasLength(globalSalt)) {
            throw new IllegalArgumentException("A global password salt must be configured");
        }
        if (iterations < MINIMUM_ITERATIONS) {
            throw new IllegalArgumentException(
                "PBKDF2 iterations must be at least " + MINIMUM_ITERATIONS + " but was " + iterations);
        }
        this.globalEncoder = new Pbkdf2PasswordEncoder(globalSalt, 0, iterations, ALGORITHM);
        this.iterations = iterations;
    }

    @Override
    public String encode(CharSequence rawPassword) {
        return globalEncoder.encode(rawPassword);
    }

    @Override
    public boolean matches(CharSequence rawPassword, String encodedPassword) {
        if (rawPassword == null || !StringUtils.hasLength(encodedPassword)) {
            return false;
        }

        int separator = encodedPassword.indexOf(LEGACY_SALT_SEPARATOR);
        if (separator >= 0) {
            return matchesLegacy(rawPassword,
                encodedPassword.substring(0, separator),
                encodedPassword.substring(separator + 1));
        }
        return matchesHex(globalEncoder, rawPassword, encodedPassword);
    }

    private boolean matchesLegacy(CharSequence rawPassword, String saltHex, String hashHex) {
        byte[] salt;
        try {
            salt = Hex.decode(saltHex);
        } catch (IllegalArgumentException ex) {
            return false;
        }
        if (salt.length == 0) {
            return false;
        }
        // Legacy values are salt followed by hash, which is the library's own stored layout.
        Pbkdf2PasswordEncoder legacyEncoder = new Pbkdf2PasswordEncoder("", salt.length, iterations, ALGORITHM);
        return matchesHex(legacyEncoder, rawPassword, saltHex + hashHex);
    }

    private static boolean matchesHex(Pbkdf2PasswordEncoder encoder, CharSequence rawPassword, String hex) {
        try {
            return encoder.matches(rawPassword, hex);
        } catch (IllegalArgumentException ex) {
            // not hex
            return false;
        }
    }
}
