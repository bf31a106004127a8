package dev.careeriq.dto;

import dev.careeriq.model.EnrichmentOutcome;

/**
 * The three narrative overlays of one analysis, each independently present or degraded.
 */
public record EnrichmentResult(
        EnrichmentOutcome<AiAnalysisNarrative> analysis,
        EnrichmentOutcome<RoleAnalysisNarrative> role,
        EnrichmentOutcome<ResumeImprovementNarrative> improvement
) {

    public static EnrichmentResult degraded(String reason) {
        return new EnrichmentResult(
                EnrichmentOutcome.degraded(reason),
                EnrichmentOutcome.degraded(reason),
                EnrichmentOutcome.degraded(reason));
    }

    public static EnrichmentResult disabled() {
        return degraded("disabled");
    }

    public boolean anyPresent() {
        return analysis.isPresent() || role.isPresent() || improvement.isPresent();
    }
}
