package dev.careeriq.model;

import java.util.List;

public record Suggestions(List<SkillSuggestion> skillsToAdd, List<ProjectIdea> projects, List<ActionStep> steps) {

    public Suggestions {
        skillsToAdd = List.copyOf(skillsToAdd);
        projects = List.copyOf(projects);
        steps = List.copyOf(steps);
    }
}
