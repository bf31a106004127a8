package dev.careeriq.config;

import dev.careeriq.TestFixtures;
import dev.careeriq.model.ExperienceLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisTuningTest {

    private final AnalysisTuning tuning = TestFixtures.tuning();

    @ParameterizedTest(name = "{0} years -> {1}")
    @CsvSource({
            "0, ENTRY",
            "2, ENTRY",
            "2.1, MID",
            "5, MID",
            "5.5, SENIOR",
            "12, SENIOR"
    })
    @DisplayName("Should tier candidates by years of experience")
    void shouldTierCandidates(double years, ExperienceLevel expected) {
        assertThat(tuning.levelForYears(years)).isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0}+ years asked -> {1}")
    @CsvSource({
            "1, ENTRY",
            "2, ENTRY",
            "3, MID",
            "4, MID",
            "5, SENIOR",
            "8, SENIOR"
    })
    @DisplayName("Should treat a posting asking for the mid threshold as senior")
    void shouldTierPostings(int years, ExperienceLevel expected) {
        assertThat(tuning.expectedLevelForYears(years)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should reject readiness weights that do not sum to one")
    void shouldRejectWeights() {
        assertThatThrownBy(() -> new AnalysisTuning(2, 5, 0.5, 0.2, 0.2, 3, 2, 5, 10, 3, 3, 5, 8))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sum to 1.0");
    }

    @Test
    @DisplayName("Should reject inverted experience thresholds")
    void shouldRejectThresholds() {
        assertThatThrownBy(() -> new AnalysisTuning(5, 2, 0.6, 0.2, 0.2, 3, 2, 5, 10, 3, 3, 5, 8))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject empty roadmap buckets")
    void shouldRejectCapacity() {
        assertThatThrownBy(() -> new AnalysisTuning(2, 5, 0.6, 0.2, 0.2, 3, 2, 5, 10, 3, 0, 5, 8))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacities");
    }

    @Test
    @DisplayName("Resilience settings should convert seconds and reject non-positive values")
    void shouldConfigureResilience() {
        ResilienceConfig config = new ResilienceConfig(5, 8);

        assertThat(config.getExternalTimeout()).hasSeconds(5);
        assertThat(config.getAnalysisDeadline()).hasSeconds(8);
        assertThatThrownBy(() -> new ResilienceConfig(0, 8)).isInstanceOf(IllegalArgumentException.class);
    }
}
