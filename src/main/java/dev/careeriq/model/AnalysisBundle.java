package dev.careeriq.model;

import java.util.List;
import java.util.Map;

/**
 * Read-only qualitative analysis derived from a resume profile, a requirement and their match.
 */
public record AnalysisBundle(
        MatchResult match,
        String targetRole,
        ExperienceAssessment experience,
        StructureQuality structure,
        RoleReadiness readiness,
        List<PrioritizedSkill> strengths,
        Map<SkillToken, String> evidence,
        List<String> experienceHighlights,
        List<PrioritizedSkill> weaknesses,
        List<String> improvementAreas,
        int confidence
) {

    public static final String NO_EVIDENCE = "Mentioned in resume";

    public AnalysisBundle {
        strengths = List.copyOf(strengths);
        evidence = Map.copyOf(evidence);
        experienceHighlights = List.copyOf(experienceHighlights);
        weaknesses = List.copyOf(weaknesses);
        improvementAreas = List.copyOf(improvementAreas);
    }

    /** Resume context showing where a strength was found. */
    public String evidenceFor(SkillToken skill) {
        return evidence.getOrDefault(skill, NO_EVIDENCE);
    }
}
