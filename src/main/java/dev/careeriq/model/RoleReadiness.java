package dev.careeriq.model;

/**
 * Composite readiness for the target role with the component scores it was blended from.
 */
public record RoleReadiness(int score, String level, int match, int structure, int experienceFit) {}
