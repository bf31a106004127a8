package dev.careeriq.service;

import dev.careeriq.config.AnalysisTuning;
import dev.careeriq.model.LearningRoadmap;
import dev.careeriq.model.PrioritizedSkill;
import dev.careeriq.model.RoadmapPhase;
import dev.careeriq.model.RoadmapPlan;
import dev.careeriq.model.SkillDefinition;
import dev.careeriq.model.SkillToken;
import dev.careeriq.model.SkillVocabulary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds 30, 60 and 90 day learning plans from missing skills.
 * <p>
 * Each horizon takes as many skills as its buckets can hold, highest priority first. The
 * selected skills are ordered by learning effort (then priority, then original position)
 * and dealt into consecutive buckets of near-equal size, so average effort never
 * decreases from one bucket to the next. Skills beyond the horizon's capacity are
 * reported as deferred. No step depends on anything but the input, so identical input
 * gives an identical plan.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LearningRoadmapService {

    private static final Map<String, String> FOCUS_AREAS = Map.ofEntries(
            Map.entry("language", "Programming Languages"),
            Map.entry("backend", "Backend Development"),
            Map.entry("frontend", "Frontend Development"),
            Map.entry("database", "Databases"),
            Map.entry("cloud", "Cloud Platforms"),
            Map.entry("devops", "DevOps & Infrastructure"),
            Map.entry("data", "Data Analysis"),
            Map.entry("ml", "Machine Learning"),
            Map.entry("mobile", "Mobile Development"),
            Map.entry("testing", "Testing & Quality"),
            Map.entry("practice", "Engineering Practices"),
            Map.entry("soft", "Professional Skills"));

    private final SkillVocabulary vocabulary;
    private final AnalysisTuning tuning;

    /**
     * @param missing missing skills sorted by priority
     */
    public LearningRoadmap buildRoadmap(List<PrioritizedSkill> missing, String targetRole) {
        LearningRoadmap roadmap = new LearningRoadmap(
                targetRole,
                plan(thirtyDay(), missing, targetRole),
                plan(sixtyDay(), missing, targetRole),
                plan(ninetyDay(), missing, targetRole));
        log.debug("Roadmap for '{}': {}/{}/{} deferred", targetRole,
                roadmap.thirtyDay().deferredSkills().size(),
                roadmap.sixtyDay().deferredSkills().size(),
                roadmap.ninetyDay().deferredSkills().size());
        return roadmap;
    }

    private Horizon thirtyDay() {
        return new Horizon("30 days", 30,
                List.of("Week 1", "Week 2", "Week 3", "Week 4"),
                List.of("Foundation Building", "Hands-on Practice", "Advanced Learning", "Integration & Portfolio"),
                List.of("Set up a practice repository and development environment",
                        "Complete hands-on exercises for each topic",
                        "Solve a realistic problem with this week's topics",
                        "Combine the month's skills in one small portfolio project"),
                tuning.getWeekCapacity());
    }

    private Horizon sixtyDay() {
        return new Horizon("60 days", 60,
                List.of("Weeks 1-2", "Weeks 3-4", "Weeks 5-6", "Weeks 7-8"),
                List.of("Core Fundamentals", "Practical Application", "Advanced Topics & Specialization",
                        "Mastery & Portfolio Building"),
                List.of("Follow a structured course for each topic and take notes",
                        "Build one feature per topic in a practice project",
                        "Study performance, security and design trade-offs of each topic",
                        "Polish the portfolio and write up what you built"),
                tuning.getSixtyDayPhaseCapacity());
    }

    private Horizon ninetyDay() {
        return new Horizon("90 days", 90,
                List.of("Days 1-30", "Days 31-60", "Days 61-90"),
                List.of("Foundation", "Application", "Mastery"),
                List.of("Learn the fundamentals through courses and documentation",
                        "Apply the skills in portfolio projects with tests",
                        "Contribute to open source and prepare for interviews"),
                tuning.getNinetyDayPhaseCapacity());
    }

    RoadmapPlan plan(Horizon horizon, List<PrioritizedSkill> missing, String targetRole) {
        int buckets = horizon.labels().size();
        int capacity = horizon.capacity() * buckets;

        List<PrioritizedSkill> selected = missing.subList(0, Math.min(capacity, missing.size()));
        List<SkillToken> deferred = missing.subList(selected.size(), missing.size()).stream()
                .map(PrioritizedSkill::skill)
                .toList();

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < selected.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator
                .<Integer>comparingInt(i -> vocabulary.effortOf(selected.get(i).skill()))
                .thenComparing(i -> selected.get(i).priority())
                .thenComparingInt(i -> i));

        int base = selected.size() / buckets;
        int remainder = selected.size() % buckets;
        List<RoadmapPhase> phases = new ArrayList<>();
        int cursor = 0;
        int cumulative = 0;
        for (int k = 0; k < buckets; k++) {
            int size = base + (k < remainder ? 1 : 0);
            List<SkillToken> skills = new ArrayList<>();
            for (int j = cursor; j < cursor + size; j++) {
                skills.add(selected.get(order.get(j)).skill());
            }
            cursor += size;

            boolean last = k == buckets - 1;
            int projects = (skills.size() + 1) / 2;
            if (last && projects == 0) {
                projects = 1;
            }
            cumulative += projects;
            phases.add(new RoadmapPhase(
                    k + 1,
                    horizon.labels().get(k),
                    horizon.focuses().get(k),
                    skills,
                    tasks(skills, horizon.practiceTasks().get(k)),
                    milestone(skills, last),
                    projects,
                    cumulative));
        }

        Set<String> focusAreas = new LinkedHashSet<>();
        for (PrioritizedSkill skill : selected) {
            String category = vocabulary.categoryOf(skill.skill());
            focusAreas.add(FOCUS_AREAS.getOrDefault(category, "General Skills"));
        }

        return new RoadmapPlan(
                horizon.duration(),
                phases,
                cumulative,
                new ArrayList<>(focusAreas),
                successCriteria(horizon, selected.size(), cumulative, targetRole),
                deferred);
    }

    private List<String> tasks(List<SkillToken> skills, String practiceTask) {
        List<String> tasks = new ArrayList<>();
        for (SkillToken skill : skills) {
            String tip = vocabulary.definition(skill)
                    .map(SkillDefinition::tip)
                    .filter(t -> !t.isBlank())
                    .orElse("Work through an introductory course and a small exercise.");
            tasks.add(skill.name() + ": " + tip);
        }
        tasks.add(skills.isEmpty() ? "Review earlier material and strengthen your existing skills" : practiceTask);
        return tasks;
    }

    private String milestone(List<SkillToken> skills, boolean last) {
        if (skills.isEmpty()) {
            return last
                    ? "One portfolio project published with a clear README"
                    : "Notes and exercises from earlier phases reviewed and cleaned up";
        }
        String names = skills.stream().map(SkillToken::name).collect(Collectors.joining(", "));
        return last
                ? "Portfolio project using " + names + " published on GitHub"
                : "Working exercise committed for each of: " + names;
    }

    private String successCriteria(Horizon horizon, int skills, int projects, String targetRole) {
        if (skills == 0) {
            return "Existing skills deepened and " + projects + " portfolio project completed";
        }
        if (horizon.days() >= 90) {
            return "Job-ready for " + targetRole + ": " + skills + " new skills learned, "
                    + projects + " portfolio projects completed and resume updated";
        }
        return "Working knowledge of " + skills + " new skills demonstrated in "
                + projects + (projects == 1 ? " project" : " projects");
    }

    record Horizon(String duration, int days, List<String> labels, List<String> focuses,
                   List<String> practiceTasks, int capacity) {}
}
