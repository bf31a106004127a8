package dev.careeriq.service;

import dev.careeriq.dto.EnrichmentResult;
import dev.careeriq.dto.ResultEnvelope;
import dev.careeriq.dto.ResultEnvelope.ActionableStep;
import dev.careeriq.dto.ResultEnvelope.AdvancedAnalysis;
import dev.careeriq.dto.ResultEnvelope.EducationItem;
import dev.careeriq.dto.ResultEnvelope.ExperienceItem;
import dev.careeriq.dto.ResultEnvelope.ExperienceLevelView;
import dev.careeriq.dto.ResultEnvelope.Fundamental;
import dev.careeriq.dto.ResultEnvelope.LearningRoadmapView;
import dev.careeriq.dto.ResultEnvelope.MissingFundamental;
import dev.careeriq.dto.ResultEnvelope.ProjectItem;
import dev.careeriq.dto.ResultEnvelope.ProjectToBuild;
import dev.careeriq.dto.ResultEnvelope.ReadinessBreakdown;
import dev.careeriq.dto.ResultEnvelope.ReadinessScore;
import dev.careeriq.dto.ResultEnvelope.ResumeData;
import dev.careeriq.dto.ResultEnvelope.ResumeStructure;
import dev.careeriq.dto.ResultEnvelope.RoadmapPhaseView;
import dev.careeriq.dto.ResultEnvelope.RoadmapPlanView;
import dev.careeriq.dto.ResultEnvelope.SkillToAdd;
import dev.careeriq.dto.ResultEnvelope.SmartSuggestions;
import dev.careeriq.dto.ResultEnvelope.Strengths;
import dev.careeriq.dto.ResultEnvelope.Weaknesses;
import dev.careeriq.exception.AnalysisInvariantException;
import dev.careeriq.model.AnalysisBundle;
import dev.careeriq.model.AnalysisReport;
import dev.careeriq.model.JobRequirement;
import dev.careeriq.model.LearningRoadmap;
import dev.careeriq.model.MatchResult;
import dev.careeriq.model.PrioritizedSkill;
import dev.careeriq.model.ResumeProfile;
import dev.careeriq.model.RoadmapPhase;
import dev.careeriq.model.RoadmapPlan;
import dev.careeriq.model.SkillToken;
import dev.careeriq.model.Suggestions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders an analysis report and its enrichment into the response envelope.
 * <p>
 * Narrative overlays are copied only when present; degraded ones leave their field out, so
 * clients never see placeholder text. The match partition is checked before anything is
 * rendered and a broken partition fails the request.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ResultComposerService {

    private final RecommendationService recommendationService;
    private final SkillRecommendationService skillRecommendationService;

    public ResultEnvelope compose(AnalysisReport report, EnrichmentResult enrichment) {
        MatchResult match = report.match();
        checkPartition(match, report.requirement());

        AnalysisBundle bundle = report.bundle();
        ResultEnvelope envelope = ResultEnvelope.builder()
                .matchScore(match.score())
                .matchedSkills(names(match.matched()))
                .missingSkills(names(match.missing()))
                .extraSkills(names(match.extra()))
                .matchedSkillCount(match.matched().size())
                .resumeSkillCount(report.profile().skills().size())
                .jobSkillCount(report.requirement().requiredSkills().size())
                .resumeData(resumeData(report.profile()))
                .recommendations(recommendationService.recommend(bundle))
                .skillRecommendations(skillRecommendationService.recommend(bundle.weaknesses(), report.profile().skills()))
                .advancedAnalysis(advancedAnalysis(bundle))
                .smartSuggestions(smartSuggestions(report.suggestions()))
                .learningRoadmap(learningRoadmap(report.roadmap()))
                .build();

        enrichment.analysis().content().ifPresent(envelope::setAiAnalysis);
        enrichment.role().content().ifPresent(envelope::setRoleAnalysis);
        enrichment.improvement().content().ifPresent(envelope::setResumeImprovement);
        envelope.setAiEnabled(enrichment.anyPresent());
        return envelope;
    }

    /**
     * Matched and missing must be disjoint and together equal the required skills.
     *
     * @throws AnalysisInvariantException when they are not
     */
    void checkPartition(MatchResult match, JobRequirement requirement) {
        Set<SkillToken> overlap = new HashSet<>(match.matched());
        overlap.retainAll(match.missing());
        if (!overlap.isEmpty()) {
            throw new AnalysisInvariantException("Matched and missing skills overlap: " + overlap);
        }
        Set<SkillToken> union = new HashSet<>(match.matched());
        union.addAll(match.missing());
        if (!union.equals(new HashSet<>(requirement.requiredSkills()))) {
            throw new AnalysisInvariantException("Matched and missing skills do not partition the "
                    + requirement.requiredSkills().size() + " required skills");
        }
        if (match.score() < 0 || match.score() > 100) {
            throw new AnalysisInvariantException("Match score out of range: " + match.score());
        }
    }

    private ResumeData resumeData(ResumeProfile profile) {
        return ResumeData.builder()
                .education(profile.education().stream()
                        .map(e -> new EducationItem(e.degree(), e.institution(), e.year()))
                        .toList())
                .experience(profile.experience().stream()
                        .map(e -> new ExperienceItem(e.title(), e.company(), e.duration()))
                        .toList())
                .skills(names(profile.skills()))
                .projects(profile.projects().stream()
                        .map(p -> new ProjectItem(p.name(), p.description()))
                        .toList())
                .build();
    }

    private AdvancedAnalysis advancedAnalysis(AnalysisBundle bundle) {
        return AdvancedAnalysis.builder()
                .roleReadinessScore(ReadinessScore.builder()
                        .score(bundle.readiness().score())
                        .level(bundle.readiness().level())
                        .breakdown(new ReadinessBreakdown(
                                bundle.readiness().match(),
                                bundle.readiness().structure(),
                                bundle.readiness().experienceFit()))
                        .build())
                .targetRole(bundle.targetRole())
                .experienceLevel(ExperienceLevelView.builder()
                        .level(bundle.experience().level().label())
                        .description(bundle.experience().level().description())
                        .yearsExperience(bundle.experience().years())
                        .expectedLevel(bundle.experience().expectedLevel().label())
                        .build())
                .strengths(new Strengths(
                        bundle.strengths().stream()
                                .map(s -> new Fundamental(s.skill().name(), s.priority().value(), s.rationale(),
                                        bundle.evidenceFor(s.skill())))
                                .toList(),
                        bundle.experienceHighlights()))
                .weaknesses(new Weaknesses(
                        bundle.weaknesses().stream().map(ResultComposerService::missingFundamental).toList(),
                        bundle.improvementAreas()))
                .resumeStructure(new ResumeStructure(
                        bundle.structure().score(),
                        bundle.structure().quality(),
                        bundle.structure().messages()))
                .confidence(bundle.confidence())
                .build();
    }

    private static MissingFundamental missingFundamental(PrioritizedSkill skill) {
        return new MissingFundamental(
                skill.skill().name(),
                skill.priority().value(),
                skill.priority().importance(),
                skill.rationale());
    }

    private SmartSuggestions smartSuggestions(Suggestions suggestions) {
        return SmartSuggestions.builder()
                .skillsToAdd(suggestions.skillsToAdd().stream()
                        .map(s -> new SkillToAdd(s.skill().name(), s.priority().value(), s.reason(),
                                s.action(), s.timeline(), s.resource()))
                        .toList())
                .projectsToBuild(suggestions.projects().stream()
                        .map(p -> new ProjectToBuild(p.title(), p.description(), names(p.skills()),
                                p.complexity(), p.timeline()))
                        .toList())
                .actionableSteps(suggestions.steps().stream()
                        .map(s -> new ActionableStep(s.step(), s.kind().value(), s.action(), s.why(), s.timeline()))
                        .toList())
                .build();
    }

    private LearningRoadmapView learningRoadmap(LearningRoadmap roadmap) {
        return LearningRoadmapView.builder()
                .targetRole(roadmap.targetRole())
                .thirtyDay(plan(roadmap.thirtyDay(), true, false))
                .sixtyDay(plan(roadmap.sixtyDay(), false, false))
                .ninetyDay(plan(roadmap.ninetyDay(), false, true))
                .build();
    }

    private RoadmapPlanView plan(RoadmapPlan plan, boolean weekly, boolean cumulative) {
        List<RoadmapPhaseView> phases = plan.phases().stream()
                .map(phase -> phase(phase, weekly, cumulative))
                .toList();
        return RoadmapPlanView.builder()
                .duration(plan.duration())
                .weeks(weekly ? phases : null)
                .phases(weekly ? null : phases)
                .totalProjects(plan.totalProjects())
                .focusAreas(plan.focusAreas())
                .successCriteria(plan.successCriteria())
                .deferredSkills(names(plan.deferredSkills()))
                .build();
    }

    private static RoadmapPhaseView phase(RoadmapPhase phase, boolean weekly, boolean cumulative) {
        return RoadmapPhaseView.builder()
                .week(weekly ? phase.index() : null)
                .phase(weekly ? null : phase.index())
                .label(phase.label())
                .focus(phase.focus())
                .skills(names(phase.skills()))
                .tasks(phase.tasks())
                .milestone(phase.milestone())
                .projects(phase.projects())
                .cumulativeProjects(cumulative ? phase.cumulativeProjects() : null)
                .build();
    }

    private static List<String> names(Collection<SkillToken> skills) {
        return skills.stream().map(SkillToken::name).toList();
    }
}
