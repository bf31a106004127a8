package dev.careeriq.exception;

/**
 * The request carries nothing that can be analysed. The message is an i18n key.
 */
public class InvalidAnalysisInputException extends RuntimeException {

    public InvalidAnalysisInputException(String messageKey) {
        super(messageKey);
    }
}
