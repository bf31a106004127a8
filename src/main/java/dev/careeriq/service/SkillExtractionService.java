package dev.careeriq.service;

import dev.careeriq.model.SkillToken;
import dev.careeriq.model.SkillVocabulary;
import dev.careeriq.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds canonical skills in free text using the controlled vocabulary.
 * <p>
 * Text is tokenized and lemmatized with {@link TextNormalizer}, then scanned left to right
 * trying the longest vocabulary phrase first, so "machine learning" yields one skill and
 * not two. Tokens inside a matched phrase are consumed. A compound token such as
 * "react/vue" that is not itself a known surface form is split and its parts scanned.
 * Only vocabulary skills are ever returned.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SkillExtractionService {

    private final SkillVocabulary vocabulary;

    /**
     * Distinct skills in order of first mention. Null or blank text yields an empty set.
     */
    public Set<SkillToken> extract(String text) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(extractMentions(text).keySet()));
    }

    /**
     * Mention count per skill, in order of first mention.
     */
    public Map<SkillToken, Integer> extractMentions(String text) {
        Map<SkillToken, Integer> mentions = new LinkedHashMap<>();
        List<String> tokens = new ArrayList<>(TextNormalizer.tokenize(text));
        int maxPhrase = vocabulary.getMaxPhraseTokens();

        int i = 0;
        while (i < tokens.size()) {
            int matchedLength = 0;
            for (int length = Math.min(maxPhrase, tokens.size() - i); length >= 1; length--) {
                Optional<SkillToken> skill = vocabulary.lookupPhrase(String.join(" ", tokens.subList(i, i + length)));
                if (skill.isPresent()) {
                    mentions.merge(skill.get(), 1, Integer::sum);
                    matchedLength = length;
                    break;
                }
            }
            if (matchedLength > 0) {
                i += matchedLength;
                continue;
            }

            String token = tokens.get(i);
            if (TextNormalizer.isCompound(token)) {
                tokens.remove(i);
                tokens.addAll(i, TextNormalizer.splitCompound(token));
                continue;
            }
            i++;
        }

        if (log.isDebugEnabled()) {
            log.debug("Extracted {} distinct skills from {} tokens", mentions.size(), tokens.size());
        }
        return mentions;
    }
}
