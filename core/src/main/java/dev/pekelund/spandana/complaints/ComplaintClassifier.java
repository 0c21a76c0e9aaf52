package dev.pekelund.spandana.complaints;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Routes a complaint to a department and an urgency tier using ordered keyword
 * tables.
 *
 * <p>Both tables are evaluated top to bottom and the first rule whose keyword is a
 * substring of the inspected text wins, so the order of the rules decides ties
 * (a complaint mentioning both water and roads goes to the Water Department).
 * Matching is plain substring matching on lower-cased text; keywords also match
 * inside longer words. The department table looks at the complaint type and the
 * description, the urgency table at the description only. Any emergency keyword
 * in the description forces {@link UrgencyLevel#HIGH}.
 */
public class ComplaintClassifier {

    private static final List<KeywordRule<Department>> DEFAULT_DEPARTMENT_RULES = List.of(
        KeywordRule.of("electricity", Department.ELECTRICAL),
        KeywordRule.of("water", Department.WATER),
        KeywordRule.of("road", Department.PUBLIC_WORKS),
        KeywordRule.of("sanitation", Department.SANITATION),
        KeywordRule.of("tax", Department.REVENUE),
        KeywordRule.of("property", Department.MUNICIPAL_CORPORATION),
        KeywordRule.of("health", Department.HEALTH),
        KeywordRule.of("education", Department.EDUCATION),
        KeywordRule.of("other", Department.GENERAL_ADMINISTRATION));

    private static final List<KeywordRule<UrgencyLevel>> DEFAULT_URGENCY_RULES = List.of(
        KeywordRule.of("emergency", UrgencyLevel.HIGH),
        KeywordRule.of("urgent", UrgencyLevel.HIGH),
        KeywordRule.of("critical", UrgencyLevel.HIGH),
        KeywordRule.of("important", UrgencyLevel.MEDIUM),
        KeywordRule.of("normal", UrgencyLevel.MEDIUM),
        KeywordRule.of("routine", UrgencyLevel.LOW),
        KeywordRule.of("minor", UrgencyLevel.LOW));

    private static final Set<String> DEFAULT_EMERGENCY_KEYWORDS = Set.of(
        "emergency", "urgent", "immediate", "critical", "accident", "fire", "flood");

    private final List<KeywordRule<Department>> departmentRules;
    private final Department defaultDepartment;
    private final List<KeywordRule<UrgencyLevel>> urgencyRules;
    private final UrgencyLevel defaultUrgency;
    private final Set<String> emergencyKeywords;

    public ComplaintClassifier(
        List<KeywordRule<Department>> departmentRules,
        Department defaultDepartment,
        List<KeywordRule<UrgencyLevel>> urgencyRules,
        UrgencyLevel defaultUrgency,
        Set<String> emergencyKeywords
    ) {
        this.departmentRules = List.copyOf(departmentRules);
        this.defaultDepartment = defaultDepartment;
        this.urgencyRules = List.copyOf(urgencyRules);
        this.defaultUrgency = defaultUrgency;
        this.emergencyKeywords = emergencyKeywords.stream()
            .map(keyword -> keyword.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    public static ComplaintClassifier withDefaultRules() {
        return new ComplaintClassifier(
            DEFAULT_DEPARTMENT_RULES,
            Department.GENERAL_ADMINISTRATION,
            DEFAULT_URGENCY_RULES,
            UrgencyLevel.MEDIUM,
            DEFAULT_EMERGENCY_KEYWORDS);
    }

    public Classification classify(String complaintType, String description) {
        String type = lowerCase(complaintType);
        String text = lowerCase(description);

        Department department = departmentRules.stream()
            .filter(rule -> rule.matches(type) || rule.matches(text))
            .map(KeywordRule::outcome)
            .findFirst()
            .orElse(defaultDepartment);

        UrgencyLevel urgency = urgencyRules.stream()
            .filter(rule -> rule.matches(text))
            .map(KeywordRule::outcome)
            .findFirst()
            .orElse(defaultUrgency);

        if (emergencyKeywords.stream().anyMatch(text::contains)) {
            urgency = UrgencyLevel.HIGH;
        }

        return new Classification(department, urgency);
    }

    private static String lowerCase(String value) {
        return value != null ? value.toLowerCase(Locale.ROOT) : "";
    }
}
