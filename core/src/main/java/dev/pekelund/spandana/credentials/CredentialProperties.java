package dev.pekelund.spandana.credentials;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "spandana.credentials")
public class CredentialProperties {

    /**
     * CSV file holding one {@code username,password} row per account.
     */
    private Path file = Path.of("users.csv");

    /**
     * Salt mixed into every password hash that does not carry its own salt.
     */
    private String globalSalt = "spandana_global_salt_v1";

    /**
     * PBKDF2 iteration count shared by the global and the per-record salt schemes.
     */
    private int iterations = GlobalSaltPasswordEncoder.DEFAULT_ITERATIONS;

    public Path getFile() {
        return file;
    }

    public void setFile(Path file) {
        this.file = file;
    }

    public String getGlobalSalt() {
        return globalSalt;
    }

    public void setGlobalSalt(String globalSalt) {
        this.globalSalt = globalSalt;
    }

    public int getIterations() {
        return iterations;
    }

    public void setIterations(int iterations) {
        this.iterations = iterations;
    }
}
