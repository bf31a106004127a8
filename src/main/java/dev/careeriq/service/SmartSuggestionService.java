package dev.careeriq.service;

import dev.careeriq.config.AnalysisTuning;
import dev.careeriq.model.ActionStep;
import dev.careeriq.model.PrioritizedSkill;
import dev.careeriq.model.ProjectIdea;
import dev.careeriq.model.ResumeProfile;
import dev.careeriq.model.SkillDefinition;
import dev.careeriq.model.SkillSuggestion;
import dev.careeriq.model.SkillToken;
import dev.careeriq.model.SkillVocabulary;
import dev.careeriq.model.Suggestions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns skill gaps into action items, project ideas and an ordered plan.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SmartSuggestionService {

    private static final int LEARN_STEPS = 3;
    private static final int SKILLS_PER_PROJECT = 3;

    private static final Map<String, String> RESOURCES = Map.ofEntries(
            Map.entry("language", "Official documentation and interactive tutorials"),
            Map.entry("backend", "Framework guides and API design courses"),
            Map.entry("frontend", "MDN Web Docs and framework tutorials"),
            Map.entry("database", "SQL practice platforms"),
            Map.entry("cloud", "Cloud provider free-tier labs"),
            Map.entry("devops", "Hands-on container and pipeline labs"),
            Map.entry("data", "Kaggle notebooks and public datasets"),
            Map.entry("ml", "MOOCs such as Coursera and fast.ai"),
            Map.entry("mobile", "Platform developer guides"),
            Map.entry("testing", "Testing framework documentation"),
            Map.entry("practice", "Books and practice problem sets"),
            Map.entry("soft", "Workshops and team practice"));

    private static final Map<String, String> PROJECT_TEMPLATES = Map.ofEntries(
            Map.entry("language", "Command-Line Productivity Tool"),
            Map.entry("backend", "REST API Service"),
            Map.entry("frontend", "Interactive Web Dashboard"),
            Map.entry("database", "Data-Backed Inventory App"),
            Map.entry("cloud", "Cloud-Hosted Web Application"),
            Map.entry("devops", "Automated Deployment Pipeline"),
            Map.entry("data", "Exploratory Data Analysis Report"),
            Map.entry("ml", "Prediction Model Service"),
            Map.entry("mobile", "Mobile Companion App"),
            Map.entry("testing", "Test Automation Suite"),
            Map.entry("practice", "Algorithm Visualizer"),
            Map.entry("soft", "Open-Source Team Contribution"));

    private final SkillVocabulary vocabulary;
    private final AnalysisTuning tuning;

    /**
     * @param missing missing skills, already sorted by priority
     */
    public Suggestions suggest(List<PrioritizedSkill> missing, ResumeProfile profile) {
        List<PrioritizedSkill> top = missing.stream().limit(tuning.getSuggestionLimit()).toList();

        List<SkillSuggestion> skillsToAdd = top.stream().map(this::toSuggestion).toList();
        List<ProjectIdea> projects = top.isEmpty() ? List.of(showcaseProject(profile)) : projectIdeas(top);
        List<ActionStep> steps = actionPlan(skillsToAdd, projects);

        log.debug("Suggestions: {} skills, {} projects, {} steps", skillsToAdd.size(), projects.size(), steps.size());
        return new Suggestions(skillsToAdd, projects, steps);
    }

    private SkillSuggestion toSuggestion(PrioritizedSkill missing) {
        SkillToken skill = missing.skill();
        String tip = vocabulary.definition(skill)
                .map(SkillDefinition::tip)
                .filter(t -> !t.isBlank())
                .orElse("Complete an introductory course on " + skill + " and apply it in a small project.");
        return new SkillSuggestion(
                skill,
                missing.priority(),
                missing.rationale(),
                "Learn " + skill + ": " + tip,
                timelineForEffort(vocabulary.effortOf(skill)),
                RESOURCES.getOrDefault(vocabulary.categoryOf(skill), "Online courses and documentation"));
    }

    /**
     * Groups the top missing skills by category, first-seen order, one project per group.
     * The highest-priority skill is always covered by the first project.
     */
    private List<ProjectIdea> projectIdeas(List<PrioritizedSkill> top) {
        Map<String, List<SkillToken>> byCategory = new LinkedHashMap<>();
        for (PrioritizedSkill missing : top) {
            List<SkillToken> group = byCategory.computeIfAbsent(vocabulary.categoryOf(missing.skill()), k -> new ArrayList<>());
            if (group.size() < SKILLS_PER_PROJECT) {
                group.add(missing.skill());
            }
        }

        List<ProjectIdea> ideas = new ArrayList<>();
        for (Map.Entry<String, List<SkillToken>> entry : byCategory.entrySet()) {
            if (ideas.size() >= tuning.getProjectLimit()) {
                break;
            }
            List<SkillToken> skills = entry.getValue();
            String names = joinNames(skills);
            String template = PROJECT_TEMPLATES.getOrDefault(entry.getKey(), "Portfolio Project");
            int effort = skills.stream().mapToInt(vocabulary::effortOf).sum();
            ideas.add(new ProjectIdea(
                    template + " with " + names,
                    "Build a small but complete " + template.toLowerCase(Locale.ROOT) + " that uses " + names
                            + ". Publish the code with a README describing the design and how to run it.",
                    skills,
                    complexityForEffort(effort),
                    projectTimeline(effort)));
        }
        return ideas;
    }

    private ProjectIdea showcaseProject(ResumeProfile profile) {
        List<SkillToken> skills = profile.skills().stream().limit(SKILLS_PER_PROJECT).toList();
        String description = skills.isEmpty()
                ? "Build a capstone project that demonstrates end-to-end ownership, from design to deployment."
                : "Build a capstone project that showcases " + joinNames(skills)
                        + " in depth, with tests, documentation and a live demo.";
        int effort = skills.stream().mapToInt(vocabulary::effortOf).sum();
        return new ProjectIdea("Portfolio Showcase Project", description, skills,
                complexityForEffort(effort), projectTimeline(effort));
    }

    /**
     * Learning steps first, then one build step per project, then the resume update.
     */
    private List<ActionStep> actionPlan(List<SkillSuggestion> skillsToAdd, List<ProjectIdea> projects) {
        List<ActionStep> steps = new ArrayList<>();
        for (SkillSuggestion suggestion : skillsToAdd.stream().limit(LEARN_STEPS).toList()) {
            steps.add(new ActionStep(steps.size() + 1, ActionStep.Kind.LEARN,
                    "Learn " + suggestion.skill(),
                    suggestion.reason(),
                    suggestion.timeline()));
        }
        for (ProjectIdea project : projects) {
            steps.add(new ActionStep(steps.size() + 1, ActionStep.Kind.BUILD,
                    "Build: " + project.title(),
                    project.skills().isEmpty()
                            ? "Gives recruiters concrete evidence of your abilities"
                            : "Gives recruiters concrete evidence of " + joinNames(project.skills()),
                    project.timeline()));
        }
        String resumeAction = skillsToAdd.isEmpty()
                ? "Update your resume to highlight your matched skills and the new project"
                : "Update your resume with " + joinNames(skillsToAdd.stream().map(SkillSuggestion::skill).toList())
                        + " and link the new projects";
        steps.add(new ActionStep(steps.size() + 1, ActionStep.Kind.UPDATE_RESUME,
                resumeAction,
                "Applicant tracking systems filter on the exact skills named in the job description",
                "1-2 days"));
        return steps;
    }

    static String timelineForEffort(int effort) {
        return switch (effort) {
            case 1 -> "1-2 weeks";
            case 2 -> "2-4 weeks";
            default -> "1-3 months";
        };
    }

    static String complexityForEffort(int totalEffort) {
        if (totalEffort <= 2) return "Beginner";
        if (totalEffort <= 4) return "Intermediate";
        return "Advanced";
    }

    static String projectTimeline(int totalEffort) {
        if (totalEffort <= 2) return "1-2 weeks";
        if (totalEffort <= 4) return "2-4 weeks";
        return "4-6 weeks";
    }

    private static String joinNames(List<SkillToken> skills) {
        return skills.stream().map(SkillToken::name).collect(Collectors.joining(", "));
    }
}
