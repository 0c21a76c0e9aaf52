package dev.pekelund.spandana.tickets;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "spandana.tickets")
public class TicketProperties {

    /**
     * Text placed in front of every ticket number.
     */
    private String prefix = "TCKT";

    /**
     * Number of the first ticket issued against an empty ledger.
     */
    private int start = 1001;

    public String getPrefix() {
        return prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix;
    }

    public int getStart() {
        return start;
    }

    public void setStart(int start) {
        this.start = start;
    }
}
