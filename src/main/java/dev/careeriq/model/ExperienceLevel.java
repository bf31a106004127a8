package dev.careeriq.model;

/**
 * Seniority tiers, in ascending order. The ordinal is used to measure how far a candidate
 * sits below a role's expected tier.
 */
public enum ExperienceLevel {

    ENTRY("Entry Level", "Entry-level candidate with limited professional experience"),
    MID("Mid Level", "Mid-level professional with 3-5 years of experience"),
    SENIOR("Senior Level", "Experienced professional with 5+ years of expertise");

    private final String label;
    private final String description;

    ExperienceLevel(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }

    /**
     * Number of tiers this level sits below {@code expected}; zero when it meets or exceeds it.
     */
    public int gapTo(ExperienceLevel expected) {
        return Math.max(0, expected.ordinal() - ordinal());
    }
}
