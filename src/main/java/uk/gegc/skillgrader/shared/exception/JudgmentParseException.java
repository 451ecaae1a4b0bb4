package uk.gegc.skillgrader.shared.exception;

/**
 * Exception thrown when a judge response cannot be parsed into a judgment.
 */
public class JudgmentParseException extends RuntimeException {

    public JudgmentParseException(String message) {
        super(message);
    }

    public JudgmentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
