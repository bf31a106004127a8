package dev.careeriq.service;

import dev.careeriq.dto.AiAnalysisNarrative;
import dev.careeriq.dto.ResumeImprovementNarrative;
import dev.careeriq.dto.RoleAnalysisNarrative;
import dev.careeriq.model.EnrichmentOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Recognises boilerplate that providers return instead of a real answer.
 * <p>
 * A text is a placeholder when, once every configured phrase is removed, at most one word
 * is left ("Please review your resume manually."). Longer texts that merely quote a phrase
 * are kept.
 */
@Component
@Slf4j
public class PlaceholderDetector {

    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9]+");

    private final List<Pattern> phrases;

    public PlaceholderDetector(
            @Value("${ai.placeholder-phrases:review your resume manually,review manually,ai analysis unavailable,service unavailable,rule-based analysis}")
            String placeholderPhrases) {
        this.phrases = Arrays.stream(placeholderPhrases.split(","))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .map(p -> Pattern.compile("\\b" + Pattern.quote(p.toLowerCase(Locale.ROOT)) + "\\b"))
                .toList();
        log.info("Placeholder detector initialized with {} phrases", phrases.size());
    }

    public boolean isPlaceholder(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String remaining = text.toLowerCase(Locale.ROOT);
        boolean matched = false;
        for (Pattern phrase : phrases) {
            String replaced = phrase.matcher(remaining).replaceAll(" ");
            matched |= !replaced.equals(remaining);
            remaining = replaced;
        }
        if (!matched) {
            return false;
        }
        String words = NON_WORD.matcher(remaining).replaceAll(" ").trim();
        return words.isEmpty() || words.split(" ").length <= 1;
    }

    /** Drops blank and placeholder entries; null becomes an empty list. */
    public List<String> clean(List<String> items) {
        if (items == null) {
            return List.of();
        }
        return items.stream()
                .filter(item -> item != null && !item.isBlank())
                .filter(item -> !isPlaceholder(item))
                .map(String::trim)
                .toList();
    }

    public EnrichmentOutcome<AiAnalysisNarrative> screen(AiAnalysisNarrative narrative) {
        if (isPlaceholder(narrative.getOverallAssessment())) {
            return EnrichmentOutcome.degraded("placeholder");
        }
        AiAnalysisNarrative cleaned = narrative.toBuilder()
                .strengths(clean(narrative.getStrengths()))
                .weaknesses(clean(narrative.getWeaknesses()))
                .skillGaps(clean(narrative.getSkillGaps()))
                .improvementSuggestions(clean(narrative.getImprovementSuggestions()))
                .build();
        boolean empty = isBlank(cleaned.getOverallAssessment()) && allEmpty(
                cleaned.getStrengths(), cleaned.getWeaknesses(),
                cleaned.getSkillGaps(), cleaned.getImprovementSuggestions());
        return empty ? EnrichmentOutcome.degraded("placeholder") : EnrichmentOutcome.present(cleaned);
    }

    public EnrichmentOutcome<RoleAnalysisNarrative> screen(RoleAnalysisNarrative narrative) {
        if (isPlaceholder(narrative.getSummary())) {
            return EnrichmentOutcome.degraded("placeholder");
        }
        RoleAnalysisNarrative cleaned = narrative.toBuilder()
                .recommendedSkills(clean(narrative.getRecommendedSkills()))
                .learningPath(clean(narrative.getLearningPath()))
                .build();
        boolean empty = isBlank(cleaned.getSummary())
                && allEmpty(cleaned.getRecommendedSkills(), cleaned.getLearningPath());
        return empty ? EnrichmentOutcome.degraded("placeholder") : EnrichmentOutcome.present(cleaned);
    }

    public EnrichmentOutcome<ResumeImprovementNarrative> screen(ResumeImprovementNarrative narrative) {
        ResumeImprovementNarrative cleaned = narrative.toBuilder()
                .summarySuggestions(clean(narrative.getSummarySuggestions()))
                .experienceImprovements(clean(narrative.getExperienceImprovements()))
                .skillsSectionTips(clean(narrative.getSkillsSectionTips()))
                .keywordOptimization(clean(narrative.getKeywordOptimization()))
                .formattingTips(clean(narrative.getFormattingTips()))
                .build();
        boolean empty = allEmpty(cleaned.getSummarySuggestions(), cleaned.getExperienceImprovements(),
                cleaned.getSkillsSectionTips(), cleaned.getKeywordOptimization(), cleaned.getFormattingTips());
        return empty ? EnrichmentOutcome.degraded("placeholder") : EnrichmentOutcome.present(cleaned);
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }

    @SafeVarargs
    private static boolean allEmpty(List<String>... lists) {
        return Stream.of(lists).allMatch(List::isEmpty);
    }
}
