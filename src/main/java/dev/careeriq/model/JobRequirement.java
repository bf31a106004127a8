package dev.careeriq.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Skills a job description asks for, in order of first mention, with mention counts.
 */
public record JobRequirement(
        String rawText,
        Set<SkillToken> requiredSkills,
        Map<SkillToken, Integer> mentions,
        String targetRole,
        ExperienceLevel expectedLevel
) {

    public JobRequirement {
        rawText = rawText == null ? "" : rawText;
        requiredSkills = requiredSkills == null ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(requiredSkills));
        mentions = mentions == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(mentions));
    }

    public int mentionsOf(SkillToken skill) {
        return mentions.getOrDefault(skill, 0);
    }
}
