package dev.careeriq.exception;

/**
 * The skill vocabulary or role catalog could not be loaded. Raised during startup only.
 */
public class VocabularyLoadException extends RuntimeException {

    public VocabularyLoadException(String message) {
        super(message);
    }

    public VocabularyLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
