package dev.careeriq.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.careeriq.exception.VocabularyLoadException;
import dev.careeriq.model.ExperienceLevel;
import dev.careeriq.model.RoleCatalog;
import dev.careeriq.model.RoleProfile;
import dev.careeriq.model.SkillDefinition;
import dev.careeriq.model.SkillToken;
import dev.careeriq.model.SkillVocabulary;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads the skill vocabulary and role catalog once at startup. Any problem with either
 * document aborts the application context.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class VocabularyConfig {

    @Bean
    public SkillVocabulary skillVocabulary(
            ObjectMapper objectMapper,
            @Value("${vocabulary.location:classpath:skills/vocabulary.json}") Resource location) {
        VocabularyDocument document = read(objectMapper, location, VocabularyDocument.class);
        if (document.getSkills() == null || document.getSkills().isEmpty()) {
            throw new VocabularyLoadException("Skill vocabulary is empty: " + location.getDescription());
        }

        List<SkillDefinition> definitions = new ArrayList<>();
        for (SkillEntry entry : document.getSkills()) {
            if (entry.getName() == null || entry.getName().isBlank()) {
                throw new VocabularyLoadException("Skill entry without a name in " + location.getDescription());
            }
            definitions.add(new SkillDefinition(
                    entry.getName().trim(),
                    entry.getAliases(),
                    entry.getCategory(),
                    entry.getEffort() != null ? entry.getEffort() : 2,
                    entry.getTip(),
                    entry.getWhy(),
                    entry.getRelated(),
                    entry.getMatchName() == null || entry.getMatchName()));
        }

        SkillVocabulary vocabulary;
        try {
            vocabulary = SkillVocabulary.of(document.getVersion(), definitions);
        } catch (IllegalArgumentException e) {
            throw new VocabularyLoadException(e.getMessage(), e);
        }
        log.info("Skill vocabulary {} loaded: {} skills, {} surface forms",
                vocabulary.getVersion(), vocabulary.size(), vocabulary.surfaceFormCount());
        return vocabulary;
    }

    @Bean
    public RoleCatalog roleCatalog(
            ObjectMapper objectMapper,
            SkillVocabulary vocabulary,
            @Value("${vocabulary.roles-location:classpath:skills/roles.json}") Resource location) {
        RoleDocument document = read(objectMapper, location, RoleDocument.class);
        if (document.getRoles() == null || document.getRoles().isEmpty()) {
            throw new VocabularyLoadException("Role catalog is empty: " + location.getDescription());
        }

        List<RoleProfile> roles = new ArrayList<>();
        for (RoleEntry entry : document.getRoles()) {
            if (entry.getName() == null || entry.getName().isBlank()) {
                throw new VocabularyLoadException("Role entry without a name in " + location.getDescription());
            }
            Map<SkillToken, String> rationale = new LinkedHashMap<>();
            if (entry.getRationale() != null) {
                entry.getRationale().forEach((skill, text) -> rationale.put(resolve(vocabulary, entry, skill), text));
            }
            roles.add(new RoleProfile(
                    entry.getName(),
                    entry.getKeywords(),
                    parseLevel(entry),
                    resolveAll(vocabulary, entry, entry.getHigh()),
                    resolveAll(vocabulary, entry, entry.getMedium()),
                    resolveAll(vocabulary, entry, entry.getLow()),
                    rationale));
        }

        RoleCatalog catalog;
        try {
            catalog = new RoleCatalog(document.getDefaultRole(), roles);
        } catch (IllegalArgumentException e) {
            throw new VocabularyLoadException(e.getMessage(), e);
        }
        log.info("Role catalog loaded: {} roles, default '{}'", roles.size(), catalog.getDefaultRole());
        return catalog;
    }

    private <T> T read(ObjectMapper objectMapper, Resource location, Class<T> type) {
        if (!location.exists()) {
            throw new VocabularyLoadException("Vocabulary resource not found: " + location.getDescription());
        }
        try (InputStream in = location.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new VocabularyLoadException("Failed to read " + location.getDescription(), e);
        }
    }

    private Set<SkillToken> resolveAll(SkillVocabulary vocabulary, RoleEntry role, List<String> names) {
        Set<SkillToken> tokens = new LinkedHashSet<>();
        if (names != null) {
            for (String name : names) {
                tokens.add(resolve(vocabulary, role, name));
            }
        }
        return tokens;
    }

    private SkillToken resolve(SkillVocabulary vocabulary, RoleEntry role, String name) {
        return vocabulary.byCanonicalName(name)
                .orElseThrow(() -> new VocabularyLoadException(
                        "Role '" + role.getName() + "' references unknown skill '" + name + "'"));
    }

    private ExperienceLevel parseLevel(RoleEntry entry) {
        if (entry.getExpectedLevel() == null) {
            return ExperienceLevel.MID;
        }
        try {
            return ExperienceLevel.valueOf(entry.getExpectedLevel().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new VocabularyLoadException(
                    "Role '" + entry.getName() + "' has unknown expected level " + entry.getExpectedLevel(), e);
        }
    }

    // JSON document shapes

    @Data
    static class VocabularyDocument {
        private String version;
        private List<SkillEntry> skills;
    }

    @Data
    static class SkillEntry {
        private String name;
        private List<String> aliases;
        private String category;
        private Integer effort;
        private String tip;
        private String why;
        private List<String> related;
        private Boolean matchName;
    }

    @Data
    static class RoleDocument {
        private String defaultRole;
        private List<RoleEntry> roles;
    }

    @Data
    static class RoleEntry {
        private String name;
        private List<String> keywords;
        private String expectedLevel;
        private List<String> high;
        private List<String> medium;
        private List<String> low;
        private Map<String, String> rationale;
    }
}
