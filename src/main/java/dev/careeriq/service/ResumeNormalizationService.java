package dev.careeriq.service;

import dev.careeriq.dto.AnalysisRequest;
import dev.careeriq.model.Education;
import dev.careeriq.model.Experience;
import dev.careeriq.model.Project;
import dev.careeriq.model.ResumeProfile;
import dev.careeriq.model.SkillToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Turns the document parser's sections into an immutable {@link ResumeProfile}.
 * <p>
 * Absent sections become empty lists. Skills are the parser's explicit skill list, resolved
 * against the vocabulary, followed by every skill mentioned in the summary, experience and
 * project text and the raw resume text.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ResumeNormalizationService {

    private final SkillExtractionService skillExtractionService;

    public ResumeProfile normalize(AnalysisRequest.ResumeSections sections, String resumeText) {
        AnalysisRequest.ResumeSections parsed = sections != null ? sections : new AnalysisRequest.ResumeSections();

        List<Education> education = nullSafe(parsed.getEducation()).stream()
                .filter(Objects::nonNull)
                .map(e -> new Education(trim(e.getDegree()), trim(e.getInstitution()), trim(e.getYear())))
                .toList();
        List<Experience> experience = nullSafe(parsed.getExperience()).stream()
                .filter(Objects::nonNull)
                .map(e -> new Experience(trim(e.getTitle()), trim(e.getCompany()),
                        trim(e.getDuration()), trim(e.getDescription())))
                .toList();
        List<Project> projects = nullSafe(parsed.getProjects()).stream()
                .filter(Objects::nonNull)
                .map(p -> new Project(trim(p.getName()), trim(p.getDescription())))
                .toList();

        Set<SkillToken> skills = new LinkedHashSet<>();
        for (String listed : nullSafe(parsed.getSkills())) {
            skills.addAll(skillExtractionService.extract(listed));
        }
        int listedCount = skills.size();
        skills.addAll(skillExtractionService.extract(parsed.getSummary()));
        for (Experience entry : experience) {
            skills.addAll(skillExtractionService.extract(entry.title()));
            skills.addAll(skillExtractionService.extract(entry.description()));
        }
        for (Project project : projects) {
            skills.addAll(skillExtractionService.extract(project.name()));
            skills.addAll(skillExtractionService.extract(project.description()));
        }

        String rawText = resumeText != null && !resumeText.isBlank()
                ? resumeText
                : flatten(parsed, education, experience, projects);
        skills.addAll(skillExtractionService.extract(rawText));

        log.debug("Normalized resume: {} education, {} experience, {} projects, {} skills ({} listed)",
                education.size(), experience.size(), projects.size(), skills.size(), listedCount);
        return new ResumeProfile(education, experience, projects, skills, rawText, trim(parsed.getSummary()));
    }

    /**
     * Plain-text rendition of the sections, for heuristics that read the whole resume when
     * the parser supplied no raw text.
     */
    private String flatten(AnalysisRequest.ResumeSections parsed, List<Education> education,
                           List<Experience> experience, List<Project> projects) {
        StringJoiner text = new StringJoiner("\n");
        if (parsed.getSummary() != null) text.add(parsed.getSummary());
        for (Experience e : experience) {
            text.add(joinNonNull(e.title(), e.company(), e.duration()));
            if (e.description() != null) text.add(e.description());
        }
        for (Project p : projects) {
            text.add(joinNonNull(p.name(), p.description()));
        }
        for (Education e : education) {
            text.add(joinNonNull(e.degree(), e.institution(), e.year()));
        }
        if (parsed.getSkills() != null) {
            text.add(String.join(", ", parsed.getSkills().stream().filter(Objects::nonNull).toList()));
        }
        return text.toString();
    }

    private static String joinNonNull(String... parts) {
        StringJoiner joiner = new StringJoiner(" ");
        for (String part : parts) {
            if (part != null && !part.isBlank()) joiner.add(part);
        }
        return joiner.toString();
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }

    private static String trim(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
