package dev.careeriq.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Public metadata of the loaded skill vocabulary and role catalog.
 */
public record VocabularyInfo(
        String version,
        @JsonProperty("skill_count") int skillCount,
        @JsonProperty("surface_form_count") int surfaceFormCount,
        List<String> categories,
        List<String> roles,
        @JsonProperty("default_role") String defaultRole
) {}
