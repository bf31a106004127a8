package dev.careeriq.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.careeriq.TestFixtures;
import dev.careeriq.config.ResilienceConfig;
import dev.careeriq.dto.AiAnalysisNarrative;
import dev.careeriq.dto.AnalysisRequest;
import dev.careeriq.dto.EnrichmentResult;
import dev.careeriq.dto.ResultEnvelope;
import dev.careeriq.exception.InvalidAnalysisInputException;
import dev.careeriq.metrics.AnalysisMetrics;
import dev.careeriq.model.EnrichmentOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResumeAnalysisServiceTest {

    @Mock
    private AiEnrichmentService aiEnrichmentService;

    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
    }

    private ResumeAnalysisService createService(ResilienceConfig resilienceConfig) {
        AnalysisMetrics metrics = new AnalysisMetrics(meterRegistry);
        metrics.init();
        return new ResumeAnalysisService(
                TestFixtures.normalizer(),
                TestFixtures.jobRequirements(),
                new SkillMatchService(),
                TestFixtures.advancedAnalysis(),
                new SmartSuggestionService(TestFixtures.vocabulary(), TestFixtures.tuning()),
                new LearningRoadmapService(TestFixtures.vocabulary(), TestFixtures.tuning()),
                aiEnrichmentService,
                new ResultComposerService(
                        new RecommendationService(TestFixtures.vocabulary()),
                        new SkillRecommendationService(TestFixtures.vocabulary(), TestFixtures.tuning())),
                resilienceConfig,
                metrics);
    }

    private ResumeAnalysisService createService() {
        return createService(new ResilienceConfig(5, 8));
    }

    private static AnalysisRequest request(List<String> skills, String jobDescription) {
        return AnalysisRequest.builder()
                .resumeSections(AnalysisRequest.ResumeSections.builder()
                        .skills(skills)
                        .experience(List.of(AnalysisRequest.ExperienceEntry.builder()
                                .title("Backend Developer").company("Acme").duration("Jan 2020 - Dec 2022").build()))
                        .education(List.of(AnalysisRequest.EducationEntry.builder()
                                .degree("BSc Computer Science").institution("State University").year("2019").build()))
                        .build())
                .jobDescription(jobDescription)
                .build();
    }

    private double degradedCount(String reason) {
        return meterRegistry.counter("careeriq.enrichment.degraded", "reason", reason).count();
    }

    // ============================
    // Deterministic analysis
    // ============================

    @Nested
    @DisplayName("Deterministic analysis")
    class Deterministic {

        @Test
        @DisplayName("Should match skills and fill every section with enrichment disabled")
        void shouldAnalyse() {
            when(aiEnrichmentService.enrich(any(), any(), any())).thenReturn(Mono.just(EnrichmentResult.disabled()));

            StepVerifier.create(createService().analyze(
                            request(List.of("Python", "SQL", "Docker"), "We need Python, Java and SQL")))
                    .assertNext(envelope -> {
                        assertThat(envelope.getMatchScore()).isEqualTo(67);
                        assertThat(envelope.getMatchedSkills()).containsExactly("Python", "SQL");
                        assertThat(envelope.getMissingSkills()).containsExactly("Java");
                        assertThat(envelope.getExtraSkills()).containsExactly("Docker");
                        assertThat(envelope.getAdvancedAnalysis().getExperienceLevel().getYearsExperience())
                                .isEqualTo(3.0);
                        assertThat(envelope.getLearningRoadmap().getThirtyDay().getWeeks()).hasSize(4);
                        assertThat(envelope.getRecommendations().getGeneralTips()).hasSize(5);
                        assertThat(envelope.isAiEnabled()).isFalse();
                        assertThat(envelope.getAiAnalysis()).isNull();
                    })
                    .verifyComplete();

            assertThat(meterRegistry.counter("careeriq.analysis.completed").count()).isEqualTo(1.0);
            assertThat(degradedCount("disabled")).isEqualTo(3.0);
        }

        @Test
        @DisplayName("Should serialise identical input to identical JSON")
        void shouldBeDeterministic() throws Exception {
            when(aiEnrichmentService.enrich(any(), any(), any())).thenReturn(Mono.just(EnrichmentResult.disabled()));
            ResumeAnalysisService service = createService();
            AnalysisRequest request = request(List.of("Java", "Spring", "Git"),
                    "Backend Developer: Java, Spring, Docker, Kubernetes, PostgreSQL, Kafka and AWS. 5+ years.");
            ObjectMapper objectMapper = new ObjectMapper();

            ResultEnvelope first = service.analyze(request).block();
            ResultEnvelope second = service.analyze(request).block();

            assertThat(objectMapper.writeValueAsString(first)).isEqualTo(objectMapper.writeValueAsString(second));
        }

        @Test
        @DisplayName("Should analyse raw resume text without sections")
        void shouldAnalyseRawText() {
            when(aiEnrichmentService.enrich(any(), any(), any())).thenReturn(Mono.just(EnrichmentResult.disabled()));
            AnalysisRequest request = AnalysisRequest.builder()
                    .resumeText("Software developer experienced with Java and Docker.")
                    .jobDescription("Java developer")
                    .build();

            StepVerifier.create(createService().analyze(request))
                    .assertNext(envelope -> {
                        assertThat(envelope.getMatchScore()).isEqualTo(100);
                        assertThat(envelope.getExtraSkills()).containsExactly("Docker");
                    })
                    .verifyComplete();
        }
    }

    // ============================
    // Invalid input
    // ============================

    @Test
    @DisplayName("Should still answer when an experience duration holds an absurd figure")
    void shouldTolerateOversizedDuration() {
        when(aiEnrichmentService.enrich(any(), any(), any())).thenReturn(Mono.just(EnrichmentResult.disabled()));
        AnalysisRequest request = AnalysisRequest.builder()
                .resumeSections(AnalysisRequest.ResumeSections.builder()
                        .skills(List.of("Python"))
                        .experience(List.of(
                                AnalysisRequest.ExperienceEntry.builder()
                                        .title("Analyst").company("Acme").duration("12345678901 months").build(),
                                AnalysisRequest.ExperienceEntry.builder()
                                        .title("Engineer").company("Globex").duration("9999 months").build(),
                                AnalysisRequest.ExperienceEntry.builder()
                                        .title("Lead").company("Initech").duration("9999 months").build()))
                        .build())
                .jobDescription("Python and SQL")
                .build();

        StepVerifier.create(createService().analyze(request))
                .assertNext(envelope -> {
                    assertThat(envelope.getMatchScore()).isEqualTo(50);
                    assertThat(envelope.getAdvancedAnalysis().getExperienceLevel().getYearsExperience())
                            .isEqualTo(50.0);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should reject a resume with no content without calling the provider")
    void shouldRejectEmptyResume() {
        AnalysisRequest request = AnalysisRequest.builder()
                .resumeText("   ")
                .resumeSections(AnalysisRequest.ResumeSections.builder().skills(List.of(" ")).build())
                .jobDescription("Java")
                .build();

        StepVerifier.create(createService().analyze(request))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(InvalidAnalysisInputException.class)
                        .hasMessage("error.resume_empty"))
                .verify();

        verify(aiEnrichmentService, never()).enrich(any(), any(), any());
        assertThat(meterRegistry.counter("careeriq.analysis.rejected").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("hasResumeContent should accept any non-blank text or section")
    void shouldDetectResumeContent() {
        assertThat(ResumeAnalysisService.hasResumeContent(null)).isFalse();
        assertThat(ResumeAnalysisService.hasResumeContent(new AnalysisRequest())).isFalse();
        assertThat(ResumeAnalysisService.hasResumeContent(
                AnalysisRequest.builder().resumeText("Java").build())).isTrue();
        assertThat(ResumeAnalysisService.hasResumeContent(AnalysisRequest.builder()
                .resumeSections(AnalysisRequest.ResumeSections.builder().summary("Engineer").build())
                .build())).isTrue();
        assertThat(ResumeAnalysisService.hasResumeContent(AnalysisRequest.builder()
                .resumeSections(AnalysisRequest.ResumeSections.builder()
                        .projects(List.of(AnalysisRequest.ProjectEntry.builder().name("Blog").build()))
                        .build())
                .build())).isTrue();
    }

    // ============================
    // Enrichment
    // ============================

    @Nested
    @DisplayName("Enrichment")
    class Enrichment {

        @Test
        @DisplayName("Should include present narrative overlays")
        void shouldIncludeNarrative() {
            AiAnalysisNarrative narrative = AiAnalysisNarrative.builder()
                    .overallAssessment("Good fit, Java is the gap.")
                    .build();
            when(aiEnrichmentService.enrich(any(), any(), any())).thenReturn(Mono.just(new EnrichmentResult(
                    EnrichmentOutcome.present(narrative),
                    EnrichmentOutcome.degraded("empty"),
                    EnrichmentOutcome.degraded("empty"))));

            StepVerifier.create(createService().analyze(request(List.of("Python"), "Python and Java")))
                    .assertNext(envelope -> {
                        assertThat(envelope.isAiEnabled()).isTrue();
                        assertThat(envelope.getAiAnalysis().getOverallAssessment()).isEqualTo("Good fit, Java is the gap.");
                        assertThat(envelope.getRoleAnalysis()).isNull();
                    })
                    .verifyComplete();

            assertThat(meterRegistry.counter("careeriq.enrichment.present").count()).isEqualTo(1.0);
            assertThat(degradedCount("empty")).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should return the deterministic result when enrichment misses the deadline")
        void shouldAbandonSlowEnrichment() {
            when(aiEnrichmentService.enrich(any(), any(), any())).thenReturn(Mono.never());

            StepVerifier.create(createService(new ResilienceConfig(1, 1))
                            .analyze(request(List.of("Python", "SQL"), "Python, Java and SQL")))
                    .assertNext(envelope -> {
                        assertThat(envelope.getMatchScore()).isEqualTo(67);
                        assertThat(envelope.getAdvancedAnalysis()).isNotNull();
                        assertThat(envelope.getLearningRoadmap()).isNotNull();
                        assertThat(envelope.isAiEnabled()).isFalse();
                        assertThat(envelope.getAiAnalysis()).isNull();
                    })
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));

            assertThat(degradedCount("deadline")).isEqualTo(3.0);
        }

        @Test
        @DisplayName("Should degrade when the enrichment stream fails")
        void shouldDegradeOnError() {
            when(aiEnrichmentService.enrich(any(), any(), any()))
                    .thenReturn(Mono.error(new IllegalStateException("boom")));

            StepVerifier.create(createService().analyze(request(List.of("Python"), "Python")))
                    .assertNext(envelope -> {
                        assertThat(envelope.getMatchScore()).isEqualTo(100);
                        assertThat(envelope.isAiEnabled()).isFalse();
                    })
                    .verifyComplete();

            assertThat(degradedCount("provider_error")).isEqualTo(3.0);
        }
    }
}
