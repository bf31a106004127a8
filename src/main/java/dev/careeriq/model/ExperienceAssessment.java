package dev.careeriq.model;

/**
 * Candidate seniority estimate.
 *
 * @param level           tier derived from {@code years}
 * @param years           total experience, one decimal
 * @param expectedLevel   tier the target role expects
 */
public record ExperienceAssessment(ExperienceLevel level, double years, ExperienceLevel expectedLevel) {}
