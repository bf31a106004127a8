package dev.careeriq.model;

import java.util.List;

/**
 * One entry of the controlled vocabulary.
 *
 * @param name      canonical display name
 * @param aliases   alternative surface forms folded onto the canonical name
 * @param category  coarse grouping used for project ideas and resource labels
 * @param effort    learning effort from 1 (days) to 3 (months)
 * @param tip       beginner learning advice
 * @param why       default rationale when the role catalog has none
 * @param related   neighbouring skills, canonical names
 * @param matchName whether the bare canonical name is itself a surface form
 *                  (false for ambiguous names such as "Go")
 */
public record SkillDefinition(
        String name,
        List<String> aliases,
        String category,
        int effort,
        String tip,
        String why,
        List<String> related,
        boolean matchName
) {

    public SkillDefinition {
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        related = related == null ? List.of() : List.copyOf(related);
        effort = Math.max(1, Math.min(3, effort));
        category = category == null ? "general" : category;
    }

    public SkillToken token() {
        return new SkillToken(name);
    }
}
