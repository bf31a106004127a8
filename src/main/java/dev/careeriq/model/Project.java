package dev.careeriq.model;

public record Project(String name, String description) {

    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }
}
