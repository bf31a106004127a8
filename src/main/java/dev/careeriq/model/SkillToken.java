package dev.careeriq.model;

import java.util.Objects;

/**
 * Canonical skill identifier. Two tokens are equal when their canonical names are equal,
 * whichever surface form produced them.
 */
public record SkillToken(String name) implements Comparable<SkillToken> {

    public SkillToken {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Skill name must not be blank");
        }
    }

    public static SkillToken of(String name) {
        return new SkillToken(name);
    }

    /**
     * Alphabetical ignoring case, with exact case breaking ties so that only equal tokens
     * compare as zero.
     */
    @Override
    public int compareTo(SkillToken other) {
        int byDisplay = name.compareToIgnoreCase(other.name);
        return byDisplay != 0 ? byDisplay : name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
