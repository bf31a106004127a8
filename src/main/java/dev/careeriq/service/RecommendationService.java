package dev.careeriq.service;

import dev.careeriq.dto.ResultEnvelope.GeneralTip;
import dev.careeriq.dto.ResultEnvelope.Recommendations;
import dev.careeriq.dto.ResultEnvelope.ResumeChange;
import dev.careeriq.dto.ResultEnvelope.SkillImprovement;
import dev.careeriq.dto.ResultEnvelope.StrengthenItem;
import dev.careeriq.model.AnalysisBundle;
import dev.careeriq.model.PrioritizedSkill;
import dev.careeriq.model.SkillDefinition;
import dev.careeriq.model.SkillToken;
import dev.careeriq.model.SkillVocabulary;
import dev.careeriq.model.StructureIssue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Beginner-friendly resume advice derived from the match score, the gaps and the structure issues.
 */
@Service
@RequiredArgsConstructor
public class RecommendationService {

    private static final int TOP_MISSING = 5;
    private static final int TOP_MATCHED = 3;
    private static final String SKILL_TIMELINE = "1-2 weeks for basics, 1-3 months for proficiency";

    private static final List<GeneralTip> GENERAL_TIPS = List.of(
            new GeneralTip("Use Action Verbs",
                    "Replace passive language with action verbs: 'Developed', 'Implemented', 'Designed', 'Optimized', 'Led'"),
            new GeneralTip("Quantify Achievements",
                    "Add numbers: 'Improved performance by 30%', 'Managed team of 5', 'Reduced costs by $10K'"),
            new GeneralTip("Match Keywords",
                    "Use the exact keywords from the job description in your resume, naturally and not forced"),
            new GeneralTip("Highlight Relevant Experience",
                    "Move the most relevant experience to the top of your resume"),
            new GeneralTip("Add Projects Section",
                    "If you're missing required skills, add a 'Projects' section showing you've worked with those technologies"));

    private final SkillVocabulary vocabulary;

    public Recommendations recommend(AnalysisBundle bundle) {
        List<SkillToken> topMissing = bundle.weaknesses().stream()
                .limit(TOP_MISSING)
                .map(PrioritizedSkill::skill)
                .toList();

        return Recommendations.builder()
                .summary(summary(bundle.match().score()))
                .resumeChanges(resumeChanges(topMissing, bundle.structure().issues()))
                .skillImprovements(topMissing.stream().map(this::improvement).toList())
                .strengthenExisting(bundle.match().matched().stream()
                        .limit(TOP_MATCHED)
                        .map(RecommendationService::strengthen)
                        .toList())
                .generalTips(GENERAL_TIPS.stream().map(t -> new GeneralTip(t.getTip(), t.getDescription())).toList())
                .build();
    }

    static String summary(int score) {
        if (score < 50) {
            return "Your resume has a " + score + "% match score, which indicates significant gaps. "
                    + "This is fixable: focus on aligning your resume with the job requirements.";
        }
        if (score < 70) {
            return "Your resume shows a " + score + "% match, a good foundation that needs improvement. "
                    + "With some targeted changes you can significantly increase your match score.";
        }
        return "Excellent! Your resume has a " + score + "% match score. "
                + "You're well aligned with the job requirements. Focus on highlighting your strengths.";
    }

    private List<ResumeChange> resumeChanges(List<SkillToken> topMissing, List<StructureIssue> structureIssues) {
        List<ResumeChange> changes = new ArrayList<>();
        if (!topMissing.isEmpty()) {
            String names = topMissing.stream().map(SkillToken::name).collect(Collectors.joining(", "));
            changes.add(new ResumeChange(
                    "Add Missing Skills Section",
                    "Create a dedicated 'Technical Skills' section and include: " + names + ". "
                            + "Even as a beginner, mention courses taken or projects built with these technologies.",
                    "Add these keywords to your resume: " + names));
        }
        for (StructureIssue issue : structureIssues) {
            sectionChange(issue.kind()).ifPresent(changes::add);
        }
        return changes;
    }

    private static Optional<ResumeChange> sectionChange(StructureIssue.Kind kind) {
        return switch (kind) {
            case MISSING_EDUCATION -> Optional.of(new ResumeChange(
                    "Add Education Section",
                    "List your degree, institution and graduation year, plus relevant certifications.",
                    "Add an 'Education' section"));
            case MISSING_EXPERIENCE -> Optional.of(new ResumeChange(
                    "Add Experience Section",
                    "Describe internships, jobs or volunteer work with your title, the company and the dates.",
                    "Add an 'Experience' section with dated entries"));
            case MISSING_PROJECTS -> Optional.of(new ResumeChange(
                    "Add Projects Section",
                    "Show two or three projects with a one-line description and the technologies used.",
                    "Add a 'Projects' section"));
            case MISSING_SKILLS -> Optional.of(new ResumeChange(
                    "Add Skills Section",
                    "List your technical skills using the names recruiters search for.",
                    "Add a 'Skills' section"));
            default -> Optional.empty();
        };
    }

    private SkillImprovement improvement(SkillToken skill) {
        String plan = vocabulary.definition(skill)
                .map(SkillDefinition::tip)
                .filter(tip -> !tip.isBlank())
                .orElse("Find a beginner-friendly course on " + skill + ", practise with small projects "
                        + "and add it to your resume once you've built something with it.");
        return new SkillImprovement(skill.name(), "Not in resume", plan, SKILL_TIMELINE);
    }

    private static StrengthenItem strengthen(SkillToken skill) {
        return new StrengthenItem(skill.name(),
                "You already have " + skill + ". To strengthen it: add specific projects where you used " + skill
                        + ", quantify your experience (e.g. 'Built 3 applications using " + skill + "'), "
                        + "mention related certifications or courses and name it in your summary.");
    }
}
