package dev.careeriq.model;

/**
 * One concrete deficiency in the resume layout. The kind is what callers branch on; the
 * message is what the user reads.
 */
public record StructureIssue(Kind kind, String message) {

    public enum Kind {
        MISSING_EDUCATION,
        MISSING_EXPERIENCE,
        MISSING_SKILLS,
        MISSING_PROJECTS,
        EXPERIENCE_WITHOUT_DURATION,
        PROJECT_WITHOUT_DESCRIPTION,
        EDUCATION_WITHOUT_INSTITUTION
    }

    public static StructureIssue of(Kind kind, String message) {
        return new StructureIssue(kind, message);
    }
}
