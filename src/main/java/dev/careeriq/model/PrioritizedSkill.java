package dev.careeriq.model;

public record PrioritizedSkill(SkillToken skill, Priority priority, int mentions, String rationale) {}
