package dev.pekelund.spandana.complaints;

import java.util.Arrays;
import java.util.Optional;

/**
 * Municipal departments a complaint can be routed to, each with its own ledger file.
 */
public enum Department {

    ELECTRICAL("Electrical Department", "electrical_department.csv"),
    WATER("Water Department", "water_department.csv"),
    PUBLIC_WORKS("Public Works Department", "public_works_department.csv"),
    SANITATION("Sanitation Department", "sanitation_department.csv"),
    REVENUE("Revenue Department", "revenue_department.csv"),
    MUNICIPAL_CORPORATION("Municipal Corporation", "municipal_corporation.csv"),
    HEALTH("Health Department", "health_department.csv"),
    EDUCATION("Education Department", "education_department.csv"),
    GENERAL_ADMINISTRATION("General Administration", "general_administration.csv");

    private final String displayName;
    private final String fileName;

    Department(String displayName, String fileName) {
        this.displayName = displayName;
        this.fileName = fileName;
    }

    public String displayName() {
        return displayName;
    }

    public String fileName() {
        return fileName;
    }

    /**
     * Resolve the department stored in the {@code Assigned Department} column.
     */
    public static Optional<Department> fromDisplayName(String displayName) {
        if (displayName == null) {
            return Optional.empty();
        }
        String trimmed = displayName.trim();
        return Arrays.stream(values())
            .filter(department -> department.displayName.equalsIgnoreCase(trimmed))
            .findFirst();
    }
}
