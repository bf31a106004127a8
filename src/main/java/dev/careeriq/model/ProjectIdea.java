package dev.careeriq.model;

import java.util.List;

public record ProjectIdea(
        String title,
        String description,
        List<SkillToken> skills,
        String complexity,
        String timeline
) {

    public ProjectIdea {
        skills = List.copyOf(skills);
    }
}
