package uk.gegc.skillgrader.shared.exception;

/**
 * Thrown when a request is well-formed JSON but semantically unusable,
 * such as a reference match request with neither text nor embedding.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
