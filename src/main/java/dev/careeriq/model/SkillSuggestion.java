package dev.careeriq.model;

/**
 * Action item for one missing skill.
 *
 * @param resource category label of where to learn it, not a link
 */
public record SkillSuggestion(
        SkillToken skill,
        Priority priority,
        String reason,
        String action,
        String timeline,
        String resource
) {}
