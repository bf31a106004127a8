package dev.careeriq.model;

public record Education(String degree, String institution, String year) {}
