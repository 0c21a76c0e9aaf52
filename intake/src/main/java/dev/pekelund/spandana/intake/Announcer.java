package dev.pekelund.spandana.intake;

/**
 * Speaks or prints what the wizard says to the citizen.
 */
public interface Announcer {

    void announce(String text);
}
