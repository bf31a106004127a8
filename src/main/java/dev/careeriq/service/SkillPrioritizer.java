package dev.careeriq.service;

import dev.careeriq.config.AnalysisTuning;
import dev.careeriq.model.JobRequirement;
import dev.careeriq.model.Priority;
import dev.careeriq.model.PrioritizedSkill;
import dev.careeriq.model.RoleCatalog;
import dev.careeriq.model.RoleProfile;
import dev.careeriq.model.SkillDefinition;
import dev.careeriq.model.SkillToken;
import dev.careeriq.model.SkillVocabulary;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Tags skills with a priority reflecting how central they are to the requirement.
 * <p>
 * A skill is high priority when the target role lists it as high or the job mentions it at
 * least {@code high-mentions} times, medium when the role lists it as medium or it is
 * mentioned at least {@code medium-mentions} times, and low otherwise.
 */
@Service
@RequiredArgsConstructor
public class SkillPrioritizer {

    private final RoleCatalog roleCatalog;
    private final SkillVocabulary vocabulary;
    private final AnalysisTuning tuning;

    /**
     * Prioritizes the given skills, sorted by priority; ties keep the input order.
     */
    public List<PrioritizedSkill> prioritize(Collection<SkillToken> skills, JobRequirement requirement) {
        RoleProfile role = roleCatalog.profileOrDefault(requirement.targetRole());
        List<PrioritizedSkill> result = new ArrayList<>(skills.size());
        for (SkillToken skill : skills) {
            int mentions = requirement.mentionsOf(skill);
            result.add(new PrioritizedSkill(skill, priorityOf(skill, mentions, role), mentions, rationale(skill, role)));
        }
        result.sort(Comparator.comparing(PrioritizedSkill::priority));
        return result;
    }

    Priority priorityOf(SkillToken skill, int mentions, RoleProfile role) {
        Optional<Priority> tier = role.tierOf(skill);
        if (tier.orElse(null) == Priority.HIGH || mentions >= tuning.getHighPriorityMentions()) {
            return Priority.HIGH;
        }
        if (tier.orElse(null) == Priority.MEDIUM || mentions >= tuning.getMediumPriorityMentions()) {
            return Priority.MEDIUM;
        }
        return Priority.LOW;
    }

    private String rationale(SkillToken skill, RoleProfile role) {
        return role.rationaleFor(skill)
                .or(() -> vocabulary.definition(skill).map(SkillDefinition::why).filter(why -> !why.isBlank()))
                .orElse("Important skill for " + role.name() + " role");
    }
}
