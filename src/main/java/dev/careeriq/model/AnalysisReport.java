package dev.careeriq.model;

/**
 * Deterministic part of one analysis, computed before narrative enrichment is merged in.
 */
public record AnalysisReport(
        ResumeProfile profile,
        JobRequirement requirement,
        AnalysisBundle bundle,
        Suggestions suggestions,
        LearningRoadmap roadmap
) {

    public MatchResult match() {
        return bundle.match();
    }
}
