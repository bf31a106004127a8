package dev.careeriq.model;

import java.util.List;

/**
 * One week or phase of a learning plan.
 *
 * @param projects           portfolio projects planned in this phase
 * @param cumulativeProjects projects planned up to and including this phase
 */
public record RoadmapPhase(
        int index,
        String label,
        String focus,
        List<SkillToken> skills,
        List<String> tasks,
        String milestone,
        int projects,
        int cumulativeProjects
) {

    public RoadmapPhase {
        skills = List.copyOf(skills);
        tasks = List.copyOf(tasks);
    }
}
