package com.example.cruscotto.application.exception;

/**
 * Raised for malformed table queries: unparseable dates, an inverted date range or an unknown
 * date column.
 */
public class InvalidQueryException extends UseCaseValidationException {

    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
