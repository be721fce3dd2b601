package com.example.cruscotto.interfaces.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Error envelope returned by every REST endpoint.
 *
 * @param error   stable error code such as {@code TABLE_NOT_FOUND}
 * @param path    request path that produced the error
 * @param details extra context (the missing table, the missing report); left out of the JSON when absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        Map<String, Object> details
) {
    public static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status.value(), error, message, path, null);
    }

    public ErrorResponse withDetails(Map<String, Object> extra) {
        return new ErrorResponse(timestamp, status, error, message, path, Map.copyOf(extra));
    }
}
