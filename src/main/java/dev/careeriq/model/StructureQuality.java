package dev.careeriq.model;

import java.util.List;

public record StructureQuality(int score, String quality, List<StructureIssue> issues) {

    public StructureQuality {
        issues = List.copyOf(issues);
    }

    public List<String> messages() {
        return issues.stream().map(StructureIssue::message).toList();
    }

    public boolean has(StructureIssue.Kind kind) {
        return issues.stream().anyMatch(issue -> issue.kind() == kind);
    }
}
