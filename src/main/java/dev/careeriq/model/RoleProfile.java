package dev.careeriq.model;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Target role as known to the catalog: detection keywords, expected seniority and the
 * skills the role treats as high, medium and low priority.
 */
public record RoleProfile(
        String name,
        List<String> keywords,
        ExperienceLevel expectedLevel,
        Set<SkillToken> high,
        Set<SkillToken> medium,
        Set<SkillToken> low,
        Map<SkillToken, String> rationale
) {

    public RoleProfile {
        keywords = keywords == null ? List.of() : keywords.stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableList());
        expectedLevel = expectedLevel == null ? ExperienceLevel.MID : expectedLevel;
        high = high == null ? Set.of() : Set.copyOf(high);
        medium = medium == null ? Set.of() : Set.copyOf(medium);
        low = low == null ? Set.of() : Set.copyOf(low);
        rationale = rationale == null ? Map.of() : Map.copyOf(rationale);
    }

    /**
     * Priority tier the role assigns to a skill, if it lists the skill at all.
     */
    public Optional<Priority> tierOf(SkillToken skill) {
        if (high.contains(skill)) return Optional.of(Priority.HIGH);
        if (medium.contains(skill)) return Optional.of(Priority.MEDIUM);
        if (low.contains(skill)) return Optional.of(Priority.LOW);
        return Optional.empty();
    }

    public Optional<String> rationaleFor(SkillToken skill) {
        return Optional.ofNullable(rationale.get(skill));
    }

    /**
     * Occurrences of the detection keywords in already lower-cased text. A keyword only
     * counts as a whole word, so "sre" does not hit inside "measure".
     */
    public int keywordHits(String lowerText) {
        int hits = 0;
        for (String keyword : keywords) {
            Matcher matcher = Pattern.compile("(?<![a-z0-9])" + Pattern.quote(keyword) + "(?![a-z0-9])")
                    .matcher(lowerText);
            while (matcher.find()) {
                hits++;
            }
        }
        return hits;
    }
}
