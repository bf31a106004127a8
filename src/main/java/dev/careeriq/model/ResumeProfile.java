package dev.careeriq.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Normalized resume. Sections are never null; skills keep first-occurrence order.
 */
public record ResumeProfile(
        List<Education> education,
        List<Experience> experience,
        List<Project> projects,
        Set<SkillToken> skills,
        String rawText,
        String summary
) {

    public ResumeProfile {
        education = education == null ? List.of() : List.copyOf(education);
        experience = experience == null ? List.of() : List.copyOf(experience);
        projects = projects == null ? List.of() : List.copyOf(projects);
        skills = skills == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(skills));
        rawText = rawText == null ? "" : rawText;
    }
}
