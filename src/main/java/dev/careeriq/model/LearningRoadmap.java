package dev.careeriq.model;

public record LearningRoadmap(String targetRole, RoadmapPlan thirtyDay, RoadmapPlan sixtyDay, RoadmapPlan ninetyDay) {}
