package dev.careeriq.service;

import dev.careeriq.config.AnalysisTuning;
import dev.careeriq.model.AnalysisBundle;
import dev.careeriq.model.Education;
import dev.careeriq.model.Experience;
import dev.careeriq.model.ExperienceAssessment;
import dev.careeriq.model.ExperienceLevel;
import dev.careeriq.model.JobRequirement;
import dev.careeriq.model.MatchResult;
import dev.careeriq.model.PrioritizedSkill;
import dev.careeriq.model.Project;
import dev.careeriq.model.ResumeProfile;
import dev.careeriq.model.SkillToken;
import dev.careeriq.model.RoleReadiness;
import dev.careeriq.model.StructureIssue;
import dev.careeriq.model.StructureIssue.Kind;
import dev.careeriq.model.StructureQuality;
import dev.careeriq.util.DurationParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Qualitative signals on top of the base match: experience tier, structural quality,
 * role readiness, strengths and weaknesses.
 * <p>
 * Every method is a pure function of its arguments, the tuning and the clock.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AdvancedAnalysisService {

    static final int SECTION_POINTS = 20;
    static final int DURATION_DETAIL_POINTS = 10;
    static final int PROJECT_DETAIL_POINTS = 5;
    static final int EDUCATION_DETAIL_POINTS = 5;

    private static final Pattern QUANTIFIED_ACHIEVEMENT = Pattern.compile(
            "\\d+\\s*(%|percent|x\\b|users|customers|clients|projects|people|members|requests|ms\\b|k\\b|\\$)"
                    + "|\\$\\s*\\d+");
    private static final Pattern EXPERIENCE_HIGHLIGHT = Pattern.compile(
            "\\b(?:increased|improved|reduced|built|developed|managed|led)\\b[^\\n]*?"
                    + "(?:\\d+\\s*%|\\d+\\s*(?:users|projects|team|people|customers))",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PORTFOLIO_LINK = Pattern.compile("github\\.com|gitlab\\.com|portfolio|bitbucket\\.org");
    private static final int MIN_RESUME_WORDS = 200;
    private static final int MAX_HIGHLIGHTS = 5;
    private static final int EVIDENCE_LENGTH = 100;

    private final SkillPrioritizer skillPrioritizer;
    private final SkillExtractionService skillExtractionService;
    private final AnalysisTuning tuning;
    private final Clock clock;

    public AnalysisBundle analyze(ResumeProfile profile, JobRequirement requirement, MatchResult match) {
        ExperienceAssessment experience = assessExperience(profile, requirement.expectedLevel());
        StructureQuality structure = assessStructure(profile);
        RoleReadiness readiness = roleReadiness(match.score(), structure.score(), experience);
        List<PrioritizedSkill> strengths = skillPrioritizer.prioritize(match.matched(), requirement);
        List<PrioritizedSkill> weaknesses = skillPrioritizer.prioritize(match.missing(), requirement);

        AnalysisBundle bundle = new AnalysisBundle(
                match,
                requirement.targetRole(),
                experience,
                structure,
                readiness,
                strengths,
                evidence(profile.rawText(), match.matched()),
                experienceHighlights(profile.rawText()),
                weaknesses,
                improvementAreas(profile),
                confidence(profile, requirement));
        log.debug("Advanced analysis: level={}, structure={}, readiness={} ({})",
                experience.level(), structure.score(), readiness.score(), readiness.level());
        return bundle;
    }

    // ============================
    // Experience level
    // ============================

    /**
     * Total experience from entry durations. When no entry has a readable duration, falls
     * back to the largest "N years" mentioned in the resume text, then to one year per entry.
     * The sum is capped at {@link DurationParser#MAX_MONTHS}.
     */
    public ExperienceAssessment assessExperience(ResumeProfile profile, ExperienceLevel expectedLevel) {
        LocalDate today = LocalDate.now(clock);
        int months = 0;
        boolean anyParsed = false;
        for (Experience entry : profile.experience()) {
            OptionalInt parsed = DurationParser.parseMonths(entry.duration(), today);
            if (parsed.isPresent()) {
                months = Math.min(months + parsed.getAsInt(), DurationParser.MAX_MONTHS);
                anyParsed = true;
            }
        }

        double years;
        if (anyParsed) {
            years = months / 12.0;
        } else {
            OptionalInt mentioned = DurationParser.maxYearsMentioned(profile.rawText());
            years = mentioned.isPresent() ? mentioned.getAsInt() : profile.experience().size();
        }
        years = Math.round(years * 10) / 10.0;
        return new ExperienceAssessment(tuning.levelForYears(years), years, expectedLevel);
    }

    // ============================
    // Structure quality
    // ============================

    /**
     * Section presence (20 points each for education, experience, skills, projects) plus up
     * to 20 detail points: experience entries with durations, projects with descriptions,
     * education entries naming an institution.
     */
    public StructureQuality assessStructure(ResumeProfile profile) {
        List<StructureIssue> issues = new ArrayList<>();
        double score = 0;

        if (!profile.education().isEmpty()) {
            score += SECTION_POINTS;
        } else {
            issues.add(StructureIssue.of(Kind.MISSING_EDUCATION, "Missing education section"));
        }
        if (!profile.experience().isEmpty()) {
            score += SECTION_POINTS;
        } else {
            issues.add(StructureIssue.of(Kind.MISSING_EXPERIENCE, "Missing experience section"));
        }
        if (!profile.skills().isEmpty()) {
            score += SECTION_POINTS;
        } else {
            issues.add(StructureIssue.of(Kind.MISSING_SKILLS, "No recognizable skills listed"));
        }
        if (!profile.projects().isEmpty()) {
            score += SECTION_POINTS;
        } else {
            issues.add(StructureIssue.of(Kind.MISSING_PROJECTS, "No projects listed"));
        }

        if (!profile.experience().isEmpty()) {
            long withDuration = profile.experience().stream().filter(Experience::hasDuration).count();
            score += DURATION_DETAIL_POINTS * (double) withDuration / profile.experience().size();
            long without = profile.experience().size() - withDuration;
            if (without > 0) {
                issues.add(StructureIssue.of(Kind.EXPERIENCE_WITHOUT_DURATION,
                        without + (without == 1 ? " experience entry is" : " experience entries are")
                                + " missing a duration"));
            }
        }
        if (!profile.projects().isEmpty()) {
            long described = profile.projects().stream().filter(Project::hasDescription).count();
            score += PROJECT_DETAIL_POINTS * (double) described / profile.projects().size();
            long without = profile.projects().size() - described;
            if (without > 0) {
                issues.add(StructureIssue.of(Kind.PROJECT_WITHOUT_DESCRIPTION,
                        without + (without == 1 ? " project is" : " projects are") + " missing a description"));
            }
        }
        if (!profile.education().isEmpty()) {
            long named = profile.education().stream()
                    .map(Education::institution)
                    .filter(institution -> institution != null && !institution.isBlank())
                    .count();
            score += EDUCATION_DETAIL_POINTS * (double) named / profile.education().size();
            long without = profile.education().size() - named;
            if (without > 0) {
                issues.add(StructureIssue.of(Kind.EDUCATION_WITHOUT_INSTITUTION,
                        without + (without == 1 ? " education entry is" : " education entries are")
                                + " missing an institution"));
            }
        }

        int rounded = (int) Math.round(score);
        return new StructureQuality(rounded, qualityLabel(rounded), issues);
    }

    static String qualityLabel(int score) {
        if (score >= 80) return "Excellent";
        if (score >= 60) return "Good";
        return "Needs Improvement";
    }

    // ============================
    // Role readiness
    // ============================

    /**
     * Weighted blend of match score, structure score and experience fit. Experience fit is
     * 100 at or above the expected tier, 60 one tier below, 20 two tiers below.
     */
    public RoleReadiness roleReadiness(int matchScore, int structureScore, ExperienceAssessment experience) {
        int fit = experienceFit(experience.level(), experience.expectedLevel());
        int score = (int) Math.round(tuning.getMatchWeight() * matchScore
                + tuning.getStructureWeight() * structureScore
                + tuning.getExperienceWeight() * fit);
        score = Math.max(0, Math.min(100, score));
        return new RoleReadiness(score, readinessLabel(score), matchScore, structureScore, fit);
    }

    static int experienceFit(ExperienceLevel actual, ExperienceLevel expected) {
        return switch (actual.gapTo(expected)) {
            case 0 -> 100;
            case 1 -> 60;
            default -> 20;
        };
    }

    static String readinessLabel(int score) {
        if (score >= 80) return "Highly Ready";
        if (score >= 60) return "Ready with Minor Gaps";
        if (score >= 40) return "Needs Improvement";
        return "Significant Gaps";
    }

    // ============================
    // Strength evidence
    // ============================

    /**
     * For each matched skill, the first resume line mentioning it together with its
     * neighbouring lines, cut to 100 characters. Skills only found in the parsed sections
     * have no entry.
     */
    Map<SkillToken, String> evidence(String rawText, Set<SkillToken> matched) {
        Map<SkillToken, String> evidence = new LinkedHashMap<>();
        if (matched.isEmpty() || rawText.isBlank()) {
            return evidence;
        }
        String[] lines = rawText.split("\\R");
        for (int i = 0; i < lines.length && evidence.size() < matched.size(); i++) {
            for (SkillToken skill : skillExtractionService.extract(lines[i])) {
                if (matched.contains(skill) && !evidence.containsKey(skill)) {
                    evidence.put(skill, context(lines, i));
                }
            }
        }
        return evidence;
    }

    private static String context(String[] lines, int index) {
        StringJoiner joiner = new StringJoiner(" ");
        for (int i = Math.max(0, index - 1); i <= Math.min(lines.length - 1, index + 1); i++) {
            if (!lines[i].isBlank()) {
                joiner.add(lines[i].trim());
            }
        }
        String context = joiner.toString();
        return context.length() > EVIDENCE_LENGTH ? context.substring(0, EVIDENCE_LENGTH) + "..." : context;
    }

    /**
     * Quantified achievements: an action verb followed on the same line by a percentage or
     * a count of users, projects, people or customers. At most five, in resume order.
     */
    List<String> experienceHighlights(String rawText) {
        List<String> highlights = new ArrayList<>();
        Matcher matcher = EXPERIENCE_HIGHLIGHT.matcher(rawText);
        while (highlights.size() < MAX_HIGHLIGHTS && matcher.find()) {
            highlights.add(matcher.group().trim());
        }
        return highlights;
    }

    // ============================
    // Weaknesses beyond skills
    // ============================

    List<String> improvementAreas(ResumeProfile profile) {
        List<String> areas = new ArrayList<>();
        String text = profile.rawText().toLowerCase(Locale.ROOT);
        if (!QUANTIFIED_ACHIEVEMENT.matcher(text).find()) {
            areas.add("Add quantified achievements (numbers, percentages, impact metrics)");
        }
        int words = text.isBlank() ? 0 : text.trim().split("\\s+").length;
        if (words < MIN_RESUME_WORDS) {
            areas.add("Expand the resume with more detail on responsibilities and impact");
        }
        if (!PORTFOLIO_LINK.matcher(text).find()) {
            areas.add("Add a GitHub or portfolio link to showcase your work");
        }
        return areas;
    }

    /**
     * Confidence in the analysis: up to 30 points for resume length (full at 1000 characters),
     * up to 20 for job description length (full at 500), 10 per extracted requirement up to 50.
     */
    int confidence(ResumeProfile profile, JobRequirement requirement) {
        double resumePart = Math.min(profile.rawText().length() / 1000.0, 1.0) * 30;
        double jobPart = Math.min(requirement.rawText().length() / 500.0, 1.0) * 20;
        int requirementPart = Math.min(requirement.requiredSkills().size() * 10, 50);
        return (int) Math.round(resumePart + jobPart + requirementPart);
    }
}
