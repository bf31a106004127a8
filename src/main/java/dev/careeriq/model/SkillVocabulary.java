package dev.careeriq.model;

import dev.careeriq.util.TextNormalizer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Controlled skill vocabulary: canonical skills plus an index from normalized surface
 * phrases to canonical tokens.
 * <p>
 * Built once at startup and never mutated afterwards; every collection it exposes is
 * unmodifiable, so concurrent requests read it without synchronization.
 */
@Slf4j
public final class SkillVocabulary {

    @Getter
    private final String version;
    @Getter
    private final List<SkillDefinition> skills;
    private final Map<String, SkillDefinition> byName;
    private final Map<String, SkillToken> surfaceIndex;
    @Getter
    private final int maxPhraseTokens;

    private SkillVocabulary(String version, List<SkillDefinition> skills,
                            Map<String, SkillDefinition> byName,
                            Map<String, SkillToken> surfaceIndex, int maxPhraseTokens) {
        this.version = version;
        this.skills = skills;
        this.byName = byName;
        this.surfaceIndex = surfaceIndex;
        this.maxPhraseTokens = maxPhraseTokens;
    }

    /**
     * Builds the vocabulary and its phrase index.
     *
     * @throws IllegalArgumentException when two skills share a canonical name
     */
    public static SkillVocabulary of(String version, List<SkillDefinition> definitions) {
        Map<String, SkillDefinition> byName = new LinkedHashMap<>();
        Map<String, SkillToken> index = new LinkedHashMap<>();
        int maxTokens = 1;

        for (SkillDefinition definition : definitions) {
            String key = definition.name().toLowerCase(Locale.ROOT);
            if (byName.putIfAbsent(key, definition) != null) {
                throw new IllegalArgumentException("Duplicate skill in vocabulary: " + definition.name());
            }
        }

        for (SkillDefinition definition : definitions) {
            SkillToken token = definition.token();
            if (definition.matchName()) {
                maxTokens = Math.max(maxTokens, register(index, definition.name(), token));
            }
            for (String alias : definition.aliases()) {
                maxTokens = Math.max(maxTokens, register(index, alias, token));
            }
        }

        return new SkillVocabulary(
                version,
                List.copyOf(definitions),
                Collections.unmodifiableMap(byName),
                Collections.unmodifiableMap(index),
                maxTokens);
    }

    private static int register(Map<String, SkillToken> index, String surface, SkillToken token) {
        String phrase = TextNormalizer.normalizePhrase(surface);
        if (phrase.isEmpty()) {
            return 0;
        }
        SkillToken existing = index.putIfAbsent(phrase, token);
        if (existing != null && !existing.equals(token)) {
            log.warn("Surface form '{}' already maps to {}, ignored for {}", surface, existing, token);
        }
        return phrase.split(" ").length;
    }

    /**
     * Canonical token for a normalized phrase, if the phrase is a known surface form.
     */
    public Optional<SkillToken> lookupPhrase(String normalizedPhrase) {
        return Optional.ofNullable(surfaceIndex.get(normalizedPhrase));
    }

    public Optional<SkillDefinition> definition(SkillToken token) {
        return Optional.ofNullable(byName.get(token.name().toLowerCase(Locale.ROOT)));
    }

    /**
     * Canonical token for a display name, as used by the role catalog.
     */
    public Optional<SkillToken> byCanonicalName(String name) {
        return Optional.ofNullable(byName.get(name.toLowerCase(Locale.ROOT))).map(SkillDefinition::token);
    }

    /** Learning effort 1-3, defaulting to 2 for tokens outside the vocabulary. */
    public int effortOf(SkillToken token) {
        return definition(token).map(SkillDefinition::effort).orElse(2);
    }

    public String categoryOf(SkillToken token) {
        return definition(token).map(SkillDefinition::category).orElse("general");
    }

    public int size() {
        return skills.size();
    }

    public int surfaceFormCount() {
        return surfaceIndex.size();
    }
}
