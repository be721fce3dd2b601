package com.example.cruscotto.application.exception;

/**
 * Thrown when a CSV export is requested for rows that cannot be exported, such as an empty
 * query result.
 */
public class CsvExportValidationException extends UseCaseValidationException {

    public CsvExportValidationException(String message) {
        super(message);
    }
}
