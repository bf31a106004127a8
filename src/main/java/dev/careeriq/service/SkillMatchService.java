package dev.careeriq.service;

import dev.careeriq.model.MatchResult;
import dev.careeriq.model.SkillToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Uniformly weighted set comparison of resume skills against required skills.
 */
@Service
@Slf4j
public class SkillMatchService {

    /**
     * Partitions {@code required} into matched and missing (both in required order) and
     * collects resume skills the job does not ask for (in resume order).
     * <p>
     * The score is {@code round(100 * |matched| / |required|)}, and 0 when nothing is required.
     */
    public MatchResult match(Set<SkillToken> resumeSkills, Set<SkillToken> requiredSkills) {
        Set<SkillToken> matched = new LinkedHashSet<>();
        Set<SkillToken> missing = new LinkedHashSet<>();
        for (SkillToken skill : requiredSkills) {
            if (resumeSkills.contains(skill)) {
                matched.add(skill);
            } else {
                missing.add(skill);
            }
        }

        Set<SkillToken> extra = new LinkedHashSet<>();
        for (SkillToken skill : resumeSkills) {
            if (!requiredSkills.contains(skill)) {
                extra.add(skill);
            }
        }

        int score = requiredSkills.isEmpty()
                ? 0
                : (int) Math.round(100.0 * matched.size() / requiredSkills.size());

        log.debug("Matched {}/{} required skills, {} extra, score {}",
                matched.size(), requiredSkills.size(), extra.size(), score);
        return new MatchResult(score, matched, missing, extra);
    }
}
