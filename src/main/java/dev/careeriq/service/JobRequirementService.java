package dev.careeriq.service;

import dev.careeriq.model.ExperienceLevel;
import dev.careeriq.model.JobRequirement;
import dev.careeriq.model.RoleProfile;
import dev.careeriq.model.SkillToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Derives a {@link JobRequirement} from job description text with the same extractor used
 * for resumes. A blank description gives an empty requirement rather than an error.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobRequirementService {

    private final SkillExtractionService skillExtractionService;
    private final RoleDetectionService roleDetectionService;

    public JobRequirement fromJobDescription(String jobDescription, String targetRoleHint) {
        if (jobDescription == null || jobDescription.isBlank()) {
            log.warn("Blank job description, no requirements will be matched");
        }
        Map<SkillToken, Integer> mentions = skillExtractionService.extractMentions(jobDescription);
        RoleProfile role = roleDetectionService.detectRole(jobDescription, targetRoleHint);
        ExperienceLevel expected = roleDetectionService.expectedLevel(jobDescription, role);

        log.debug("Job requires {} skills, target role '{}', expected level {}",
                mentions.size(), role.name(), expected);
        return new JobRequirement(jobDescription, mentions.keySet(), mentions, role.name(), expected);
    }
}
