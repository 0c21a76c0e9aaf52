package dev.pekelund.spandana.complaints;

public record Classification(Department department, UrgencyLevel urgency) {
}
