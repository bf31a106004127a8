package dev.careeriq.controller;

import dev.careeriq.TestFixtures;
import dev.careeriq.service.AiEnrichmentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.info.BuildProperties;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ApiInfoControllerTest {

    @Mock
    private AiEnrichmentService aiEnrichmentService;

    private ApiInfoController controller;

    @BeforeEach
    void setUp() {
        controller = new ApiInfoController(null, "2.0.0", TestFixtures.vocabulary(), aiEnrichmentService);
        ReflectionTestUtils.setField(controller, "appName", "Career-IQ API");
        ReflectionTestUtils.setField(controller, "appDescription", "Resume to job description matching and analysis");
    }

    @Nested
    @DisplayName("GET /api")
    class GetApiInfo {

        @Test
        @DisplayName("Should return API info with name, description and versions")
        @SuppressWarnings("unchecked")
        void shouldReturnApiInfo() {
            StepVerifier.create(controller.getApiInfo())
                    .assertNext(response -> {
                        assertThat(response.getStatusCode().value()).isEqualTo(200);
                        Map<String, Object> body = response.getBody();
                        assertThat(body).isNotNull();
                        assertThat(body.get("name")).isEqualTo("Career-IQ API");
                        assertThat(body.get("description")).isEqualTo("Resume to job description matching and analysis");
                        assertThat(body.get("health")).isEqualTo("/api/health");
                        assertThat((Map<String, String>) body.get("versions")).containsEntry("latest", "/api/v1");
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("GET /api/v1")
    class GetV1Info {

        @Test
        @DisplayName("Should list the analysis endpoints")
        @SuppressWarnings("unchecked")
        void shouldReturnV1Info() {
            StepVerifier.create(controller.getV1Info())
                    .assertNext(response -> {
                        Map<String, Object> body = response.getBody();
                        assertThat(body).isNotNull();
                        assertThat(body.get("status")).isEqualTo("stable");
                        assertThat((Map<String, String>) body.get("endpoints"))
                                .containsEntry("analysis", "/api/v1/analysis")
                                .containsEntry("vocabulary", "/api/v1/analysis/vocabulary");
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("GET /api/health")
    class HealthCheck {

        @Test
        @DisplayName("Should report vocabulary version and enrichment availability")
        void shouldReturnHealth() {
            when(aiEnrichmentService.isAvailable()).thenReturn(true);

            StepVerifier.create(controller.healthCheck())
                    .assertNext(response -> {
                        Map<String, Object> body = response.getBody();
                        assertThat(body).isNotNull();
                        assertThat(body.get("status")).isEqualTo("UP");
                        assertThat(body.get("version")).isEqualTo("2.0.0");
                        assertThat(body.get("vocabulary_version")).isEqualTo("2025.2");
                        assertThat(body.get("ai_enabled")).isEqualTo(true);
                        assertThat(body.get("timestamp")).isNotNull();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should prefer the build version when build info is available")
        void shouldUseBuildVersion() {
            Properties properties = new Properties();
            properties.setProperty("version", "2.1.0");
            ApiInfoController built = new ApiInfoController(new BuildProperties(properties), "2.0.0",
                    TestFixtures.vocabulary(), aiEnrichmentService);

            StepVerifier.create(built.healthCheck())
                    .assertNext(response -> assertThat(response.getBody()).containsEntry("version", "2.1.0"))
                    .verifyComplete();
        }
    }
}
