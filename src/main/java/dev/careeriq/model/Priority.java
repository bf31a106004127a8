package dev.careeriq.model;

import java.util.Locale;

/**
 * Importance of a skill for the analysed requirement. Declaration order is sort order.
 */
public enum Priority {

    HIGH("Critical"),
    MEDIUM("Important"),
    LOW("Nice to have");

    private final String importance;

    Priority(String importance) {
        this.importance = importance;
    }

    /** Wire form: "high", "medium", "low". */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String importance() {
        return importance;
    }
}
