package dev.careeriq.model;

import java.util.List;

/**
 * Learning plan for one horizon (30, 60 or 90 days).
 *
 * @param deferredSkills missing skills that did not fit the horizon's capacity
 */
public record RoadmapPlan(
        String duration,
        List<RoadmapPhase> phases,
        int totalProjects,
        List<String> focusAreas,
        String successCriteria,
        List<SkillToken> deferredSkills
) {

    public RoadmapPlan {
        phases = List.copyOf(phases);
        focusAreas = List.copyOf(focusAreas);
        deferredSkills = List.copyOf(deferredSkills);
    }
}
