package com.example.cruscotto.application.exception;

/**
 * Signals a request that cannot be executed because its parameters are inconsistent.
 */
public class UseCaseValidationException extends ApplicationException {

    public UseCaseValidationException(String message) {
        super(message);
    }

    public UseCaseValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
