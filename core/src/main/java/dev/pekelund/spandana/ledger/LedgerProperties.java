package dev.pekelund.spandana.ledger;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "spandana.ledger")
public class LedgerProperties {

    /**
     * Directory holding the master ledger and the department ledgers.
     */
    private Path directory = Path.of(".");

    /**
     * File name of the master ledger inside {@link #directory}.
     */
    private String masterFile = "users_data.csv";

    public Path getDirectory() {
        return directory;
    }

    public void setDirectory(Path directory) {
        this.directory = directory;
    }

    public String getMasterFile() {
        return masterFile;
    }

    public void setMasterFile(String masterFile) {
        this.masterFile = masterFile;
    }
}
