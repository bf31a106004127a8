package dev.careeriq.exception;

/**
 * An assembled result violates an internal consistency rule, for example a skill reported
 * as both matched and missing. Always a defect; never corrected silently.
 */
public class AnalysisInvariantException extends RuntimeException {

    public AnalysisInvariantException(String message) {
        super(message);
    }
}
