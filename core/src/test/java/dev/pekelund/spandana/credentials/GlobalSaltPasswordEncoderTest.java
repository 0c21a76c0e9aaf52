package dev.pekelund.spandana.credentials;

import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder.SecretKeyFactoryAlgorithm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GlobalSaltPasswordEncoderTest {

    private static final String GLOBAL_SALT = "test-salt";
    private static final String SECRET_HASH = "fb1e6add6affbbb6ab4d2eedf5acfaae24719d86915577eb632ae10d2c835986";
    private static final String LEGACY_HASH =
        "a1b2c3d4e5f60718$d91c123d7a4db2e2966a748892ff4e739b98ae0dc43115aae61ad0469cf84665";

    private final GlobalSaltPasswordEncoder encoder = new GlobalSaltPasswordEncoder(GLOBAL_SALT, 100_000);

    @Test
    void encodesWithTheGlobalSaltAsLowerCaseHex() {
        assertThat(encoder.encode("Secret#123")).isEqualTo(SECRET_HASH);
    }

    @Test
    void defaultSchemeMatchesTheHashesWrittenByEarlierReleases() {
        GlobalSaltPasswordEncoder defaults = new GlobalSaltPasswordEncoder(
            "spandana_global_salt_v1", GlobalSaltPasswordEncoder.DEFAULT_ITERATIONS);

        assertThat(defaults.encode("Secret#123"))
            .isEqualTo("f056f2f99c9d4bf7aed2319fa2188644986072c86fa72f1724cfe913d6f936e7");
    }

    @Test
    void globalSchemeIsTheLibraryEncoderWithoutRandomSalt() {
        Pbkdf2PasswordEncoder library = new Pbkdf2PasswordEncoder(
            GLOBAL_SALT, 0, 100_000, SecretKeyFactoryAlgorithm.PBKDF2WithHmacSHA256);

        assertThat(encoder.encode("Secret#123")).isEqualTo(library.encode("Secret#123"));
        assertThat(library.matches("Secret#123", encoder.encode("Secret#123"))).isTrue();
    }

    @Test
    void matchesBareHashes() {
        assertThat(encoder.matches("Secret#123", SECRET_HASH)).isTrue();
        assertThat(encoder.matches("secret#123", SECRET_HASH)).isFalse();
    }

    @Test
    void matchesLegacySaltedHashes() {
        assertThat(encoder.matches("Legacy#Pass1", LEGACY_HASH)).isTrue();
        assertThat(encoder.matches("Secret#123", LEGACY_HASH)).isFalse();
    }

    @Test
    void rejectsMalformedOrEmptyStoredValues() {
        assertThat(encoder.matches("Secret#123", "")).isFalse();
        assertThat(encoder.matches("Secret#123", null)).isFalse();
        assertThat(encoder.matches("Secret#123", "zz$" + SECRET_HASH)).isFalse();
        assertThat(encoder.matches("Secret#123", "$" + SECRET_HASH)).isFalse();
        assertThat(encoder.matches("Secret#123", "not-a-hash")).isFalse();
        assertThat(encoder.matches("Legacy#Pass1", "a1b2c3d4e5f60718$xyz")).isFalse();
    }

    @Test
    void refusesWeakConfiguration() {
        assertThatThrownBy(() -> new GlobalSaltPasswordEncoder(GLOBAL_SALT, 1_000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("100000");
        assertThatThrownBy(() -> new GlobalSaltPasswordEncoder("", 100_000))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
