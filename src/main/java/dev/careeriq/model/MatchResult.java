package dev.careeriq.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Partition of required skills into matched and missing, plus resume skills the job does not ask for.
 * Iteration order: required order for matched and missing, resume order for extra.
 */
public record MatchResult(
        int score,
        Set<SkillToken> matched,
        Set<SkillToken> missing,
        Set<SkillToken> extra
) {

    public MatchResult {
        matched = Collections.unmodifiableSet(new LinkedHashSet<>(matched));
        missing = Collections.unmodifiableSet(new LinkedHashSet<>(missing));
        extra = Collections.unmodifiableSet(new LinkedHashSet<>(extra));
    }

    public int requiredCount() {
        return matched.size() + missing.size();
    }
}
