package dev.careeriq.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Complete analysis result. {@code match_score} and the three skill lists are always present;
 * narrative overlays appear only when the provider returned real content.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResultEnvelope {

    @JsonProperty("match_score")
    private int matchScore;

    @JsonProperty("matched_skills")
    private List<String> matchedSkills;

    @JsonProperty("missing_skills")
    private List<String> missingSkills;

    @JsonProperty("extra_skills")
    private List<String> extraSkills;

    @JsonProperty("matched_skill_count")
    private int matchedSkillCount;

    @JsonProperty("resume_skill_count")
    private int resumeSkillCount;

    @JsonProperty("job_skill_count")
    private int jobSkillCount;

    @JsonProperty("resume_data")
    private ResumeData resumeData;

    private Recommendations recommendations;

    @JsonProperty("skill_recommendations")
    private List<SkillRecommendation> skillRecommendations;

    @JsonProperty("advanced_analysis")
    private AdvancedAnalysis advancedAnalysis;

    @JsonProperty("smart_suggestions")
    private SmartSuggestions smartSuggestions;

    @JsonProperty("learning_roadmap")
    private LearningRoadmapView learningRoadmap;

    @JsonProperty("ai_enabled")
    private boolean aiEnabled;

    @JsonProperty("ai_analysis")
    private AiAnalysisNarrative aiAnalysis;

    @JsonProperty("role_analysis")
    private RoleAnalysisNarrative roleAnalysis;

    @JsonProperty("resume_improvement")
    private ResumeImprovementNarrative resumeImprovement;

    // ==================== Resume echo ====================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ResumeData {
        private List<EducationItem> education;
        private List<ExperienceItem> experience;
        private List<String> skills;
        private List<ProjectItem> projects;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class EducationItem {
        private String degree;
        private String institution;
        private String year;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ExperienceItem {
        private String title;
        private String company;
        private String duration;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ProjectItem {
        private String name;
        private String description;
    }

    // ==================== Recommendations ====================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Recommendations {
        private String summary;
        @JsonProperty("resume_changes")
        private List<ResumeChange> resumeChanges;
        @JsonProperty("skill_improvements")
        private List<SkillImprovement> skillImprovements;
        @JsonProperty("strengthen_existing")
        private List<StrengthenItem> strengthenExisting;
        @JsonProperty("general_tips")
        private List<GeneralTip> generalTips;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResumeChange {
        private String title;
        private String description;
        private String action;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SkillImprovement {
        private String skill;
        @JsonProperty("current_status")
        private String currentStatus;
        @JsonProperty("action_plan")
        private String actionPlan;
        private String timeline;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StrengthenItem {
        private String skill;
        @JsonProperty("how_to_strengthen")
        private String howToStrengthen;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GeneralTip {
        private String tip;
        private String description;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SkillRecommendation {
        private String skill;
        private String reason;
        @JsonProperty("learning_tip")
        private String learningTip;
        private String priority;
    }

    // ==================== Advanced analysis ====================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AdvancedAnalysis {
        @JsonProperty("role_readiness_score")
        private ReadinessScore roleReadinessScore;
        @JsonProperty("target_role")
        private String targetRole;
        @JsonProperty("experience_level")
        private ExperienceLevelView experienceLevel;
        private Strengths strengths;
        private Weaknesses weaknesses;
        @JsonProperty("resume_structure")
        private ResumeStructure resumeStructure;
        private int confidence;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReadinessScore {
        private int score;
        private String level;
        private ReadinessBreakdown breakdown;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReadinessBreakdown {
        private int match;
        private int structure;
        @JsonProperty("experience_fit")
        private int experienceFit;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExperienceLevelView {
        private String level;
        private String description;
        @JsonProperty("years_experience")
        private double yearsExperience;
        @JsonProperty("expected_level")
        private String expectedLevel;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Strengths {
        private List<Fundamental> fundamentals;
        @JsonProperty("experience_highlights")
        private List<String> experienceHighlights;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Fundamental {
        private String skill;
        private String priority;
        private String rationale;
        private String evidence;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Weaknesses {
        @JsonProperty("missing_fundamentals")
        private List<MissingFundamental> missingFundamentals;
        @JsonProperty("improvement_areas")
        private List<String> improvementAreas;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MissingFundamental {
        private String skill;
        private String priority;
        private String importance;
        @JsonProperty("why_important")
        private String whyImportant;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResumeStructure {
        private int score;
        private String quality;
        private List<String> issues;
    }

    // ==================== Smart suggestions ====================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SmartSuggestions {
        @JsonProperty("skills_to_add")
        private List<SkillToAdd> skillsToAdd;
        @JsonProperty("projects_to_build")
        private List<ProjectToBuild> projectsToBuild;
        @JsonProperty("actionable_steps")
        private List<ActionableStep> actionableSteps;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SkillToAdd {
        private String skill;
        private String priority;
        private String reason;
        private String action;
        private String timeline;
        private String resource;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProjectToBuild {
        private String title;
        private String description;
        private List<String> skills;
        private String complexity;
        private String timeline;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ActionableStep {
        private int step;
        private String type;
        private String action;
        private String why;
        private String timeline;
    }

    // ==================== Learning roadmap ====================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LearningRoadmapView {
        @JsonProperty("target_role")
        private String targetRole;
        @JsonProperty("30_day")
        private RoadmapPlanView thirtyDay;
        @JsonProperty("60_day")
        private RoadmapPlanView sixtyDay;
        @JsonProperty("90_day")
        private RoadmapPlanView ninetyDay;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RoadmapPlanView {
        private String duration;
        private List<RoadmapPhaseView> weeks;
        private List<RoadmapPhaseView> phases;
        @JsonProperty("total_projects")
        private int totalProjects;
        @JsonProperty("focus_areas")
        private List<String> focusAreas;
        @JsonProperty("success_criteria")
        private String successCriteria;
        @JsonProperty("deferred_skills")
        private List<String> deferredSkills;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RoadmapPhaseView {
        private Integer week;
        private Integer phase;
        private String label;
        private String focus;
        private List<String> skills;
        private List<String> tasks;
        private String milestone;
        private Integer projects;
        @JsonProperty("cumulative_projects")
        private Integer cumulativeProjects;
    }
}
