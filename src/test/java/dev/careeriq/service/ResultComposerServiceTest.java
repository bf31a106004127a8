package dev.careeriq.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.careeriq.TestFixtures;
import dev.careeriq.dto.AiAnalysisNarrative;
import dev.careeriq.dto.AnalysisRequest;
import dev.careeriq.dto.EnrichmentResult;
import dev.careeriq.dto.ResultEnvelope;
import dev.careeriq.dto.ResultEnvelope.RoadmapPhaseView;
import dev.careeriq.exception.AnalysisInvariantException;
import dev.careeriq.model.AnalysisBundle;
import dev.careeriq.model.AnalysisReport;
import dev.careeriq.model.EnrichmentOutcome;
import dev.careeriq.model.ExperienceLevel;
import dev.careeriq.model.JobRequirement;
import dev.careeriq.model.MatchResult;
import dev.careeriq.model.ResumeProfile;
import dev.careeriq.model.SkillToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultComposerServiceTest {

    private ResultComposerService composer;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        composer = new ResultComposerService(
                new RecommendationService(TestFixtures.vocabulary()),
                new SkillRecommendationService(TestFixtures.vocabulary(), TestFixtures.tuning()));
    }

    private AnalysisReport report(List<String> resumeSkills, String jobDescription) {
        AnalysisRequest.ResumeSections sections = AnalysisRequest.ResumeSections.builder()
                .skills(resumeSkills)
                .experience(List.of(AnalysisRequest.ExperienceEntry.builder()
                        .title("Developer").company("Acme").duration("2019 - 2022").build()))
                .build();
        ResumeProfile profile = TestFixtures.normalizer().normalize(sections, null);
        JobRequirement requirement = TestFixtures.jobRequirements().fromJobDescription(jobDescription, null);
        MatchResult match = new SkillMatchService().match(profile.skills(), requirement.requiredSkills());
        AnalysisBundle bundle = TestFixtures.advancedAnalysis().analyze(profile, requirement, match);
        return new AnalysisReport(profile, requirement, bundle,
                new SmartSuggestionService(TestFixtures.vocabulary(), TestFixtures.tuning())
                        .suggest(bundle.weaknesses(), profile),
                new LearningRoadmapService(TestFixtures.vocabulary(), TestFixtures.tuning())
                        .buildRoadmap(bundle.weaknesses(), bundle.targetRole()));
    }

    // ============================
    // Partition check
    // ============================

    @Nested
    @DisplayName("checkPartition")
    class CheckPartition {

        private final JobRequirement requirement = new JobRequirement("Java and SQL",
                Set.of(SkillToken.of("Java"), SkillToken.of("SQL")), Map.of(), "Software Engineer", ExperienceLevel.MID);

        @Test
        @DisplayName("Should accept a proper partition")
        void shouldAcceptPartition() {
            composer.checkPartition(new MatchResult(50, Set.of(SkillToken.of("Java")),
                    Set.of(SkillToken.of("SQL")), Set.of()), requirement);
        }

        @Test
        @DisplayName("Should reject overlapping matched and missing skills")
        void shouldRejectOverlap() {
            MatchResult broken = new MatchResult(50, Set.of(SkillToken.of("Java")),
                    Set.of(SkillToken.of("Java"), SkillToken.of("SQL")), Set.of());

            assertThatThrownBy(() -> composer.checkPartition(broken, requirement))
                    .isInstanceOf(AnalysisInvariantException.class)
                    .hasMessageContaining("overlap");
        }

        @Test
        @DisplayName("Should reject a partition that does not cover the requirement")
        void shouldRejectIncompleteCover() {
            MatchResult broken = new MatchResult(50, Set.of(SkillToken.of("Java")), Set.of(), Set.of());

            assertThatThrownBy(() -> composer.checkPartition(broken, requirement))
                    .isInstanceOf(AnalysisInvariantException.class);
        }

        @Test
        @DisplayName("Should reject a score outside 0..100")
        void shouldRejectScore() {
            MatchResult broken = new MatchResult(101, Set.of(SkillToken.of("Java"), SkillToken.of("SQL")),
                    Set.of(), Set.of());

            assertThatThrownBy(() -> composer.checkPartition(broken, requirement))
                    .isInstanceOf(AnalysisInvariantException.class)
                    .hasMessageContaining("101");
        }
    }

    // ============================
    // Envelope
    // ============================

    @Nested
    @DisplayName("compose")
    class Compose {

        @Test
        @DisplayName("Should fill the base match fields")
        void shouldFillMatchFields() {
            ResultEnvelope envelope = composer.compose(
                    report(List.of("Python", "SQL", "Docker"), "We need Python, Java and SQL"),
                    EnrichmentResult.disabled());

            assertThat(envelope.getMatchScore()).isEqualTo(67);
            assertThat(envelope.getMatchedSkills()).containsExactly("Python", "SQL");
            assertThat(envelope.getMissingSkills()).containsExactly("Java");
            assertThat(envelope.getExtraSkills()).containsExactly("Docker");
            assertThat(envelope.getMatchedSkillCount()).isEqualTo(2);
            assertThat(envelope.getResumeSkillCount()).isEqualTo(3);
            assertThat(envelope.getJobSkillCount()).isEqualTo(3);
            assertThat(envelope.getResumeData().getExperience()).singleElement()
                    .satisfies(item -> assertThat(item.getDuration()).isEqualTo("2019 - 2022"));
            assertThat(envelope.getAdvancedAnalysis().getExperienceLevel().getYearsExperience()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("Should attach resume evidence to each strength")
        void shouldAttachEvidence() throws Exception {
            ResultEnvelope envelope = composer.compose(
                    report(List.of("Python", "SQL", "Docker"), "We need Python, Java and SQL"),
                    EnrichmentResult.disabled());

            ResultEnvelope.Strengths strengths = envelope.getAdvancedAnalysis().getStrengths();
            assertThat(strengths.getFundamentals()).extracting(ResultEnvelope.Fundamental::getSkill)
                    .containsExactlyInAnyOrder("Python", "SQL");
            assertThat(strengths.getFundamentals()).allSatisfy(fundamental ->
                    assertThat(fundamental.getEvidence()).isEqualTo("Developer Acme 2019 - 2022 Python, SQL, Docker"));
            assertThat(strengths.getExperienceHighlights()).isEmpty();

            JsonNode json = objectMapper.valueToTree(envelope).path("advanced_analysis").path("strengths");
            assertThat(json.has("experience_highlights")).isTrue();
            assertThat(json.path("fundamentals").get(0).has("evidence")).isTrue();
        }

        @Test
        @DisplayName("Should leave out degraded overlays")
        void shouldLeaveOutDegradedOverlays() throws Exception {
            ResultEnvelope envelope = composer.compose(
                    report(List.of("Python"), "Python and Java"), EnrichmentResult.degraded("timeout"));

            assertThat(envelope.isAiEnabled()).isFalse();
            assertThat(envelope.getAiAnalysis()).isNull();

            JsonNode json = objectMapper.valueToTree(envelope);
            assertThat(json.has("ai_analysis")).isFalse();
            assertThat(json.has("role_analysis")).isFalse();
            assertThat(json.has("resume_improvement")).isFalse();
            assertThat(json.get("ai_enabled").asBoolean()).isFalse();
        }

        @Test
        @DisplayName("Should include present overlays only")
        void shouldIncludePresentOverlays() {
            AiAnalysisNarrative narrative = AiAnalysisNarrative.builder()
                    .overallAssessment("Strong Python profile")
                    .strengths(List.of("Python"))
                    .build();
            EnrichmentResult enrichment = new EnrichmentResult(
                    EnrichmentOutcome.present(narrative),
                    EnrichmentOutcome.degraded("placeholder"),
                    EnrichmentOutcome.degraded("timeout"));

            ResultEnvelope envelope = composer.compose(report(List.of("Python"), "Python and Java"), enrichment);

            assertThat(envelope.isAiEnabled()).isTrue();
            assertThat(envelope.getAiAnalysis()).isSameAs(narrative);
            assertThat(envelope.getRoleAnalysis()).isNull();
            assertThat(envelope.getResumeImprovement()).isNull();
        }

        @Test
        @DisplayName("Should render weeks for 30 days and phases with cumulative projects for 90 days")
        void shouldRenderRoadmapShapes() {
            ResultEnvelope envelope = composer.compose(
                    report(List.of("Python"), "Python, Java, Docker, Kubernetes and SQL"), EnrichmentResult.disabled());

            ResultEnvelope.LearningRoadmapView roadmap = envelope.getLearningRoadmap();
            assertThat(roadmap.getThirtyDay().getPhases()).isNull();
            assertThat(roadmap.getThirtyDay().getWeeks()).extracting(RoadmapPhaseView::getWeek).containsExactly(1, 2, 3, 4);
            assertThat(roadmap.getThirtyDay().getWeeks()).allSatisfy(week -> {
                assertThat(week.getPhase()).isNull();
                assertThat(week.getCumulativeProjects()).isNull();
            });
            assertThat(roadmap.getSixtyDay().getWeeks()).isNull();
            assertThat(roadmap.getSixtyDay().getPhases()).allSatisfy(phase -> assertThat(phase.getCumulativeProjects()).isNull());
            assertThat(roadmap.getNinetyDay().getPhases()).extracting(RoadmapPhaseView::getCumulativeProjects)
                    .doesNotContainNull();

            JsonNode json = objectMapper.valueToTree(envelope);
            assertThat(json.path("learning_roadmap").has("30_day")).isTrue();
            assertThat(json.path("learning_roadmap").path("30_day").has("weeks")).isTrue();
            assertThat(json.path("learning_roadmap").path("90_day").path("phases").get(0).has("cumulative_projects")).isTrue();
        }

        @Test
        @DisplayName("Should fail the request when the partition is broken")
        void shouldFailOnBrokenPartition() {
            AnalysisReport report = report(List.of("Python"), "Python and Java");
            AnalysisBundle bundle = report.bundle();
            AnalysisBundle broken = new AnalysisBundle(
                    new MatchResult(50, Set.of(SkillToken.of("Python")), Set.of(), Set.of()),
                    bundle.targetRole(), bundle.experience(), bundle.structure(), bundle.readiness(),
                    bundle.strengths(), bundle.evidence(), bundle.experienceHighlights(),
                    bundle.weaknesses(), bundle.improvementAreas(), bundle.confidence());
            AnalysisReport brokenReport = new AnalysisReport(report.profile(), report.requirement(), broken,
                    report.suggestions(), report.roadmap());

            assertThatThrownBy(() -> composer.compose(brokenReport, EnrichmentResult.disabled()))
                    .isInstanceOf(AnalysisInvariantException.class);
        }
    }
}
