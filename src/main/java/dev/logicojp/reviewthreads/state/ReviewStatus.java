package dev.logicojp.reviewthreads.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/// Review status shared by files, folders and the overall summary.
///
/// Declared in derivation precedence order, lowest urgency first.
/// `APPROVED` and `NEEDS_WORK` are terminal: the item counts as reviewed.
public enum ReviewStatus {
    UNREVIEWED("unreviewed", "Unreviewed"),
    IN_PROGRESS("in-progress", "In Progress"),
    APPROVED("approved", "Approved"),
    NEEDS_WORK("needs-work", "Needs Work");

    private final String value;
    private final String displayName;

    ReviewStatus(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    /// Wire value as persisted in `review-state.json`.
    @JsonValue
    public String value() {
        return value;
    }

    /// Human readable label used in rendered summaries.
    public String displayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this == APPROVED || this == NEEDS_WORK;
    }

    /// Parses a wire value such as `needs-work`.
    /// @throws IllegalArgumentException if the value is not one of the four statuses
    @JsonCreator
    public static ReviewStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Review status must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ReviewStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException(
            "Invalid review status: '" + value + "'. Expected one of: unreviewed, in-progress, approved, needs-work");
    }

    @Override
    public String toString() {
        return value;
    }
}
