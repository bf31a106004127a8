package dev.careeriq.model;

public record Experience(String title, String company, String duration, String description) {

    public boolean hasDuration() {
        return duration != null && !duration.isBlank();
    }
}
