package dev.careeriq.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.careeriq.TestFixtures;
import dev.careeriq.exception.VocabularyLoadException;
import dev.careeriq.model.ExperienceLevel;
import dev.careeriq.model.Priority;
import dev.careeriq.model.RoleCatalog;
import dev.careeriq.model.SkillToken;
import dev.careeriq.model.SkillVocabulary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VocabularyConfigTest {

    private final VocabularyConfig config = new VocabularyConfig();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private static ByteArrayResource json(String content) {
        return new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8), "test document");
    }

    // ============================
    // Bundled documents
    // ============================

    @Nested
    @DisplayName("Bundled documents")
    class Bundled {

        @Test
        @DisplayName("Should load the bundled vocabulary with aliases indexed")
        void shouldLoadVocabulary() {
            SkillVocabulary vocabulary = TestFixtures.vocabulary();

            assertThat(vocabulary.getVersion()).isEqualTo("2025.2");
            assertThat(vocabulary.size()).isGreaterThan(50);
            assertThat(vocabulary.surfaceFormCount()).isGreaterThan(vocabulary.size());
            assertThat(vocabulary.byCanonicalName("docker")).contains(SkillToken.of("Docker"));
            assertThat(vocabulary.effortOf(SkillToken.of("Kubernetes"))).isEqualTo(3);
        }

        @Test
        @DisplayName("Should load the bundled role catalog in detection order")
        void shouldLoadRoles() {
            RoleCatalog catalog = TestFixtures.roleCatalog();

            assertThat(catalog.getDefaultRole()).isEqualTo("Software Engineer");
            assertThat(catalog.getRoles()).extracting(role -> role.name()).containsExactly(
                    "Backend Developer", "Frontend Developer", "Data Scientist",
                    "ML Engineer", "DevOps Engineer", "Software Engineer");
            assertThat(catalog.find("backend developer").orElseThrow().tierOf(SkillToken.of("SQL")))
                    .contains(Priority.HIGH);
            assertThat(catalog.profileOrDefault("Astronaut").name()).isEqualTo("Software Engineer");
        }
    }

    // ============================
    // Broken documents
    // ============================

    @Nested
    @DisplayName("Broken documents")
    class Broken {

        @Test
        @DisplayName("Should fail when the vocabulary resource is missing")
        void shouldFailOnMissingResource() {
            assertThatThrownBy(() -> config.skillVocabulary(objectMapper, new ClassPathResource("skills/missing.json")))
                    .isInstanceOf(VocabularyLoadException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        @DisplayName("Should fail on malformed JSON")
        void shouldFailOnMalformedJson() {
            assertThatThrownBy(() -> config.skillVocabulary(objectMapper, json("{\"skills\": [")))
                    .isInstanceOf(VocabularyLoadException.class)
                    .hasMessageContaining("Failed to read");
        }

        @Test
        @DisplayName("Should fail on an empty vocabulary")
        void shouldFailOnEmptyVocabulary() {
            assertThatThrownBy(() -> config.skillVocabulary(objectMapper, json("{\"version\": \"1\", \"skills\": []}")))
                    .isInstanceOf(VocabularyLoadException.class)
                    .hasMessageContaining("empty");
        }

        @Test
        @DisplayName("Should fail on duplicate skill names")
        void shouldFailOnDuplicates() {
            assertThatThrownBy(() -> config.skillVocabulary(objectMapper,
                    json("{\"version\": \"1\", \"skills\": [{\"name\": \"Java\"}, {\"name\": \"java\"}]}")))
                    .isInstanceOf(VocabularyLoadException.class)
                    .hasMessageContaining("Duplicate skill");
        }

        @Test
        @DisplayName("Should fail when a role references an unknown skill")
        void shouldFailOnUnknownRoleSkill() {
            SkillVocabulary vocabulary = config.skillVocabulary(objectMapper,
                    json("{\"version\": \"1\", \"skills\": [{\"name\": \"Java\"}]}"));

            assertThatThrownBy(() -> config.roleCatalog(objectMapper, vocabulary, json(
                    "{\"defaultRole\": \"Dev\", \"roles\": [{\"name\": \"Dev\", \"high\": [\"Cobol\"]}]}")))
                    .isInstanceOf(VocabularyLoadException.class)
                    .hasMessageContaining("unknown skill 'Cobol'");
        }

        @Test
        @DisplayName("Should fail when a role has no name")
        void shouldFailOnNamelessRole() {
            SkillVocabulary vocabulary = config.skillVocabulary(objectMapper,
                    json("{\"version\": \"1\", \"skills\": [{\"name\": \"Java\"}]}"));

            assertThatThrownBy(() -> config.roleCatalog(objectMapper, vocabulary, json(
                    "{\"defaultRole\": \"Dev\", \"roles\": [{\"name\": \"Dev\"}, {\"high\": [\"Java\"]}]}")))
                    .isInstanceOf(VocabularyLoadException.class)
                    .hasMessageContaining("Role entry without a name");
        }

        @Test
        @DisplayName("Should fail when the default role is not in the catalog")
        void shouldFailOnUnknownDefaultRole() {
            SkillVocabulary vocabulary = config.skillVocabulary(objectMapper,
                    json("{\"version\": \"1\", \"skills\": [{\"name\": \"Java\"}]}"));

            assertThatThrownBy(() -> config.roleCatalog(objectMapper, vocabulary, json(
                    "{\"defaultRole\": \"Manager\", \"roles\": [{\"name\": \"Dev\", \"high\": [\"Java\"]}]}")))
                    .isInstanceOf(VocabularyLoadException.class)
                    .hasMessageContaining("Manager");
        }

        @Test
        @DisplayName("Should default a role without expected level to mid")
        void shouldDefaultExpectedLevel() {
            SkillVocabulary vocabulary = config.skillVocabulary(objectMapper,
                    json("{\"version\": \"1\", \"skills\": [{\"name\": \"Java\"}]}"));

            RoleCatalog catalog = config.roleCatalog(objectMapper, vocabulary, json(
                    "{\"defaultRole\": \"Dev\", \"roles\": [{\"name\": \"Dev\", \"medium\": [\"java\"]}]}"));

            assertThat(catalog.defaultProfile().expectedLevel()).isEqualTo(ExperienceLevel.MID);
            assertThat(catalog.defaultProfile().tierOf(SkillToken.of("Java"))).contains(Priority.MEDIUM);
        }
    }
}
