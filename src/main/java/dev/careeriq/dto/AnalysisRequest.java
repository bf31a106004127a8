package dev.careeriq.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Analysis input: the document parser's output for the resume plus the job description text.
 * A blank job description is accepted and produces an empty requirement.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {

    @JsonProperty("resume_text")
    @Size(max = 100_000, message = "Resume text must not exceed 100000 characters")
    private String resumeText;

    @Valid
    @JsonProperty("resume_sections")
    private ResumeSections resumeSections;

    @JsonProperty("job_description")
    @Size(max = 50_000, message = "Job description must not exceed 50000 characters")
    private String jobDescription;

    @JsonProperty("target_role")
    @Size(max = 100)
    private String targetRole;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResumeSections {
        @Valid
        private List<EducationEntry> education;
        @Valid
        private List<ExperienceEntry> experience;
        @Valid
        private List<ProjectEntry> projects;
        private List<@Size(max = 100) String> skills;
        @Size(max = 5_000)
        private String summary;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EducationEntry {
        @Size(max = 255)
        private String degree;
        @Size(max = 255)
        private String institution;
        @Size(max = 50)
        private String year;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExperienceEntry {
        @Size(max = 255)
        private String title;
        @Size(max = 255)
        private String company;
        @Size(max = 100)
        private String duration;
        @Size(max = 10_000)
        private String description;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProjectEntry {
        @Size(max = 255)
        private String name;
        @Size(max = 10_000)
        private String description;
    }
}
