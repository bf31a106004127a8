package dev.careeriq.model;

import java.util.Locale;

/**
 * One numbered step of the action plan. Steps are ordered learn, then build, then update resume.
 */
public record ActionStep(int step, Kind kind, String action, String why, String timeline) {

    public enum Kind {
        LEARN, BUILD, UPDATE_RESUME;

        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
