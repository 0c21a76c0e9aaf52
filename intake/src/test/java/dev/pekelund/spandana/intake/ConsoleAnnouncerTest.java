package dev.pekelund.spandana.intake;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleAnnouncerTest {

    @Test
    void writesAnnouncementsInOrderBeforeClosing() {
        StringWriter output = new StringWriter();
        ConsoleAnnouncer announcer = new ConsoleAnnouncer(new PrintWriter(output), "te");

        announcer.announce("Please say your name.");
        announcer.announce("Please say your mobile number.");
        announcer.close();

        assertThat(output.toString().lines())
            .containsExactly("Please say your name.", "Please say your mobile number.");
        assertThat(announcer.getLanguage()).isEqualTo("te");
    }
}
