package dev.logicojp.reviewthreads.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/// Suggestion severity, declared in rendering order.
public enum Severity {
    HIGH("high", "Must Fix (High)"),
    MEDIUM("medium", "Should Fix (Medium)"),
    LOW("low", "Could Fix (Low)");

    private final String value;
    private final String sectionTitle;

    Severity(String value, String sectionTitle) {
        this.value = value;
        this.sectionTitle = sectionTitle;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String sectionTitle() {
        return sectionTitle;
    }

    /// Label used in severity counts, e.g. `High`.
    public String label() {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    @JsonCreator
    public static Severity fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.value.equals(normalized)) {
                return severity;
            }
        }
        throw new IllegalArgumentException(
            "Invalid severity: '" + value + "'. Expected one of: high, medium, low");
    }

    @Override
    public String toString() {
        return value;
    }
}
