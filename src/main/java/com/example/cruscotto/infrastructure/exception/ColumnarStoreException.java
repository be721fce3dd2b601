package com.example.cruscotto.infrastructure.exception;

/**
 * Signals that a Parquet table could not be written or read. Never retried automatically;
 * the batch step that triggered the write receives it.
 */
public class ColumnarStoreException extends InfrastructureException {

    public ColumnarStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
