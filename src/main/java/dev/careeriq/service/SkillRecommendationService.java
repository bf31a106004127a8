package dev.careeriq.service;

import dev.careeriq.config.AnalysisTuning;
import dev.careeriq.dto.ResultEnvelope.SkillRecommendation;
import dev.careeriq.model.Priority;
import dev.careeriq.model.PrioritizedSkill;
import dev.careeriq.model.SkillDefinition;
import dev.careeriq.model.SkillToken;
import dev.careeriq.model.SkillVocabulary;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recommends skills that usually go together with the missing ones, taken from the
 * vocabulary's related-skill lists.
 */
@Service
@RequiredArgsConstructor
public class SkillRecommendationService {

    private static final int SOURCE_LIMIT = 10;
    private static final int RELATED_PER_SKILL = 3;
    private static final int HIGH_PRIORITY_COUNT = 5;

    private final SkillVocabulary vocabulary;
    private final AnalysisTuning tuning;

    /**
     * @param missing      missing skills sorted by priority
     * @param resumeSkills skills already on the resume, never recommended
     */
    public List<SkillRecommendation> recommend(List<PrioritizedSkill> missing, Set<SkillToken> resumeSkills) {
        Set<SkillToken> excluded = new HashSet<>(resumeSkills);
        missing.forEach(m -> excluded.add(m.skill()));

        List<SkillRecommendation> recommendations = new ArrayList<>();
        for (PrioritizedSkill source : missing.stream().limit(SOURCE_LIMIT).toList()) {
            int taken = 0;
            for (String relatedName : related(source.skill())) {
                if (taken >= RELATED_PER_SKILL || recommendations.size() >= tuning.getRecommendationLimit()) {
                    break;
                }
                Optional<SkillToken> related = vocabulary.byCanonicalName(relatedName);
                if (related.isEmpty() || !excluded.add(related.get())) {
                    continue;
                }
                recommendations.add(new SkillRecommendation(
                        related.get().name(),
                        "Often used together with " + source.skill(),
                        learningTip(related.get()),
                        (recommendations.size() < HIGH_PRIORITY_COUNT ? Priority.HIGH : Priority.MEDIUM).value()));
                taken++;
            }
        }
        return recommendations;
    }

    private List<String> related(SkillToken skill) {
        return vocabulary.definition(skill).map(SkillDefinition::related).orElse(List.of());
    }

    private String learningTip(SkillToken skill) {
        return vocabulary.definition(skill)
                .map(SkillDefinition::tip)
                .filter(tip -> !tip.isBlank())
                .orElse("Start with the official documentation and build a small project to practise.");
    }
}
