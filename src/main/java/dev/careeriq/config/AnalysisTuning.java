package dev.careeriq.config;

import dev.careeriq.model.ExperienceLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Tunable thresholds and weights of the analysis. Defaults live in the annotations and in
 * {@code application.yml}; every formula that uses them is a pure function of these values.
 */
@Component
@Getter
@Slf4j
public class AnalysisTuning {

    private final double entryMaxYears;
    private final double midMaxYears;
    private final double matchWeight;
    private final double structureWeight;
    private final double experienceWeight;
    private final int highPriorityMentions;
    private final int mediumPriorityMentions;
    private final int suggestionLimit;
    private final int recommendationLimit;
    private final int projectLimit;
    private final int weekCapacity;
    private final int sixtyDayPhaseCapacity;
    private final int ninetyDayPhaseCapacity;

    public AnalysisTuning(
            @Value("${analysis.experience.entry-max-years:2}") double entryMaxYears,
            @Value("${analysis.experience.mid-max-years:5}") double midMaxYears,
            @Value("${analysis.readiness.match-weight:0.6}") double matchWeight,
            @Value("${analysis.readiness.structure-weight:0.2}") double structureWeight,
            @Value("${analysis.readiness.experience-weight:0.2}") double experienceWeight,
            @Value("${analysis.priority.high-mentions:3}") int highPriorityMentions,
            @Value("${analysis.priority.medium-mentions:2}") int mediumPriorityMentions,
            @Value("${analysis.limits.suggestions:5}") int suggestionLimit,
            @Value("${analysis.limits.recommendations:10}") int recommendationLimit,
            @Value("${analysis.limits.projects:3}") int projectLimit,
            @Value("${analysis.roadmap.week-capacity:3}") int weekCapacity,
            @Value("${analysis.roadmap.sixty-day-phase-capacity:5}") int sixtyDayPhaseCapacity,
            @Value("${analysis.roadmap.ninety-day-phase-capacity:8}") int ninetyDayPhaseCapacity
    ) {
        if (entryMaxYears <= 0 || midMaxYears <= entryMaxYears) {
            throw new IllegalArgumentException("Experience thresholds must satisfy 0 < entry-max-years < mid-max-years");
        }
        double weightSum = matchWeight + structureWeight + experienceWeight;
        if (Math.abs(weightSum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Readiness weights must sum to 1.0 but were " + weightSum);
        }
        if (weekCapacity < 1 || sixtyDayPhaseCapacity < 1 || ninetyDayPhaseCapacity < 1) {
            throw new IllegalArgumentException("Roadmap capacities must be at least 1");
        }
        this.entryMaxYears = entryMaxYears;
        this.midMaxYears = midMaxYears;
        this.matchWeight = matchWeight;
        this.structureWeight = structureWeight;
        this.experienceWeight = experienceWeight;
        this.highPriorityMentions = highPriorityMentions;
        this.mediumPriorityMentions = mediumPriorityMentions;
        this.suggestionLimit = suggestionLimit;
        this.recommendationLimit = recommendationLimit;
        this.projectLimit = projectLimit;
        this.weekCapacity = weekCapacity;
        this.sixtyDayPhaseCapacity = sixtyDayPhaseCapacity;
        this.ninetyDayPhaseCapacity = ninetyDayPhaseCapacity;
        log.info("Analysis tuning initialized (tiers={}/{}y, weights={}/{}/{})",
                entryMaxYears, midMaxYears, matchWeight, structureWeight, experienceWeight);
    }

    /**
     * Tier of a candidate with the given years of experience: up to entry-max is entry,
     * up to mid-max is mid, anything above is senior.
     */
    public ExperienceLevel levelForYears(double years) {
        if (years <= entryMaxYears) return ExperienceLevel.ENTRY;
        if (years <= midMaxYears) return ExperienceLevel.MID;
        return ExperienceLevel.SENIOR;
    }

    /**
     * Tier a job expects when it asks for at least {@code years}. A posting asking for the
     * mid-max threshold itself ("5+ years") targets the tier above it.
     */
    public ExperienceLevel expectedLevelForYears(int years) {
        if (years >= midMaxYears) return ExperienceLevel.SENIOR;
        if (years > entryMaxYears) return ExperienceLevel.MID;
        return ExperienceLevel.ENTRY;
    }
}
