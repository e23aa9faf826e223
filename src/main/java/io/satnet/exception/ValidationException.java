package io.satnet.exception;

/**
 * Malformed or expired bundle, invalid priority, exceeded hop ceiling or an illegal
 * custody status transition.
 */
public class ValidationException extends DtnException {

    public ValidationException(String message) {
        super(DtnErrorType.VALIDATION, message);
    }
}
