package dev.careeriq.service;

import dev.careeriq.config.ResilienceConfig;
import dev.careeriq.dto.AnalysisRequest;
import dev.careeriq.dto.EnrichmentResult;
import dev.careeriq.dto.ResultEnvelope;
import dev.careeriq.exception.InvalidAnalysisInputException;
import dev.careeriq.metrics.AnalysisMetrics;
import dev.careeriq.model.AnalysisBundle;
import dev.careeriq.model.AnalysisReport;
import dev.careeriq.model.JobRequirement;
import dev.careeriq.model.LearningRoadmap;
import dev.careeriq.model.MatchResult;
import dev.careeriq.model.ResumeProfile;
import dev.careeriq.model.Suggestions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Collection;
import java.util.Objects;

/**
 * Runs one analysis end to end.
 * <p>
 * Normalization, requirement extraction and matching run first. The qualitative analysis,
 * suggestions and roadmap are then computed on the parallel scheduler while narrative
 * enrichment runs alongside them; enrichment still pending at the analysis deadline is
 * abandoned and reported as degraded, so the deterministic result is never held back by
 * the provider.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ResumeAnalysisService {

    private final ResumeNormalizationService resumeNormalizationService;
    private final JobRequirementService jobRequirementService;
    private final SkillMatchService skillMatchService;
    private final AdvancedAnalysisService advancedAnalysisService;
    private final SmartSuggestionService smartSuggestionService;
    private final LearningRoadmapService learningRoadmapService;
    private final AiEnrichmentService aiEnrichmentService;
    private final ResultComposerService resultComposerService;
    private final ResilienceConfig resilienceConfig;
    private final AnalysisMetrics analysisMetrics;

    /**
     * @throws InvalidAnalysisInputException (as an error signal) when the resume carries
     *                                       neither text nor parsed sections
     */
    public Mono<ResultEnvelope> analyze(AnalysisRequest request) {
        if (!hasResumeContent(request)) {
            analysisMetrics.recordRejected();
            return Mono.error(new InvalidAnalysisInputException("error.resume_empty"));
        }
        long startNanos = System.nanoTime();

        return Mono.fromCallable(() -> match(request))
                .subscribeOn(Schedulers.parallel())
                .flatMap(matched -> Mono.zip(
                        Mono.fromCallable(() -> report(matched)).subscribeOn(Schedulers.parallel()),
                        enrich(matched)))
                .map(tuple -> {
                    analysisMetrics.recordEnrichment(tuple.getT2());
                    return resultComposerService.compose(tuple.getT1(), tuple.getT2());
                })
                .doOnNext(envelope -> {
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                    analysisMetrics.recordCompleted(elapsed);
                    log.info("Analysis completed: score={}, matched={}/{}, role='{}', ai={} in {}ms",
                            envelope.getMatchScore(), envelope.getMatchedSkillCount(), envelope.getJobSkillCount(),
                            envelope.getAdvancedAnalysis().getTargetRole(), envelope.isAiEnabled(),
                            elapsed.toMillis());
                });
    }

    private MatchStage match(AnalysisRequest request) {
        ResumeProfile profile = resumeNormalizationService.normalize(request.getResumeSections(), request.getResumeText());
        JobRequirement requirement = jobRequirementService.fromJobDescription(
                request.getJobDescription(), request.getTargetRole());
        MatchResult match = skillMatchService.match(profile.skills(), requirement.requiredSkills());
        log.debug("Matched {} of {} required skills (resume text {} chars, job text {} chars)",
                match.matched().size(), match.requiredCount(),
                profile.rawText().length(), requirement.rawText().length());
        return new MatchStage(profile, requirement, match);
    }

    private AnalysisReport report(MatchStage stage) {
        AnalysisBundle bundle = advancedAnalysisService.analyze(stage.profile(), stage.requirement(), stage.match());
        Suggestions suggestions = smartSuggestionService.suggest(bundle.weaknesses(), stage.profile());
        LearningRoadmap roadmap = learningRoadmapService.buildRoadmap(bundle.weaknesses(), bundle.targetRole());
        return new AnalysisReport(stage.profile(), stage.requirement(), bundle, suggestions, roadmap);
    }

    private Mono<EnrichmentResult> enrich(MatchStage stage) {
        return aiEnrichmentService.enrich(stage.profile(), stage.requirement(), stage.match())
                .timeout(resilienceConfig.getAnalysisDeadline(), Mono.fromSupplier(() -> {
                    log.warn("AI enrichment abandoned at the {}s analysis deadline",
                            resilienceConfig.getAnalysisDeadline().toSeconds());
                    return EnrichmentResult.degraded("deadline");
                }))
                .onErrorResume(e -> {
                    log.warn("AI enrichment failed unexpectedly: {}", e.getMessage());
                    return Mono.just(EnrichmentResult.degraded("provider_error"));
                });
    }

    static boolean hasResumeContent(AnalysisRequest request) {
        if (request == null) {
            return false;
        }
        if (request.getResumeText() != null && !request.getResumeText().isBlank()) {
            return true;
        }
        AnalysisRequest.ResumeSections sections = request.getResumeSections();
        if (sections == null) {
            return false;
        }
        return (sections.getSummary() != null && !sections.getSummary().isBlank())
                || hasAny(sections.getEducation())
                || hasAny(sections.getExperience())
                || hasAny(sections.getProjects())
                || (sections.getSkills() != null
                        && sections.getSkills().stream().anyMatch(s -> s != null && !s.isBlank()));
    }

    private static boolean hasAny(Collection<?> entries) {
        return entries != null && entries.stream().anyMatch(Objects::nonNull);
    }

    private record MatchStage(ResumeProfile profile, JobRequirement requirement, MatchResult match) {}
}
