package dev.careeriq.service;

import dev.careeriq.TestFixtures;
import dev.careeriq.dto.ResultEnvelope.SkillRecommendation;
import dev.careeriq.model.PrioritizedSkill;
import dev.careeriq.model.Priority;
import dev.careeriq.model.SkillToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SkillRecommendationServiceTest {

    private SkillRecommendationService service;

    @BeforeEach
    void setUp() {
        service = new SkillRecommendationService(TestFixtures.vocabulary(), TestFixtures.tuning());
    }

    private static PrioritizedSkill missing(String name) {
        return new PrioritizedSkill(SkillToken.of(name), Priority.HIGH, 1, "Needed");
    }

    @Test
    @DisplayName("Should recommend related skills the resume does not have")
    void shouldRecommendRelatedSkills() {
        List<SkillRecommendation> recommendations =
                service.recommend(List.of(missing("Docker")), Set.of(SkillToken.of("Kubernetes")));

        assertThat(recommendations).singleElement().satisfies(rec -> {
            assertThat(rec.getSkill()).isEqualTo("CI/CD");
            assertThat(rec.getReason()).isEqualTo("Often used together with Docker");
            assertThat(rec.getPriority()).isEqualTo("high");
            assertThat(rec.getLearningTip()).isNotBlank();
        });
    }

    @Test
    @DisplayName("Should never recommend a skill that is already missing")
    void shouldSkipMissingSkills() {
        List<SkillRecommendation> recommendations =
                service.recommend(List.of(missing("Python"), missing("Django")), Set.of());

        assertThat(recommendations).extracting(SkillRecommendation::getSkill)
                .doesNotContain("Python", "Django")
                .startsWith("Flask", "FastAPI", "Pandas");
    }

    @Test
    @DisplayName("Should take at most three per source, cap the total and lower priority after five")
    void shouldCapAndGrade() {
        List<SkillRecommendation> recommendations = service.recommend(
                List.of(missing("Python"), missing("JavaScript"), missing("SQL"), missing("Java")), Set.of());

        assertThat(recommendations).extracting(SkillRecommendation::getSkill).containsExactly(
                "Django", "Flask", "FastAPI",
                "TypeScript", "React", "Node.js",
                "PostgreSQL", "MySQL", "Database Design",
                "Spring");
        assertThat(recommendations).extracting(SkillRecommendation::getPriority).containsExactly(
                "high", "high", "high", "high", "high",
                "medium", "medium", "medium", "medium", "medium");
    }

    @Test
    @DisplayName("Should return nothing when nothing is missing")
    void shouldReturnEmpty() {
        assertThat(service.recommend(List.of(), Set.of(SkillToken.of("Java")))).isEmpty();
    }
}
