package uk.gegc.clubaccess.shared.exception;

/**
 * Bad caller input, rejected before any side effect.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
