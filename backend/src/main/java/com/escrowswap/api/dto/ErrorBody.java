package com.escrowswap.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Standard error response body: error (code), message, timestamp (ISO 8601) and optional details.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorBody(String error, String message, Instant timestamp, Map<String, String> details) {

    /**
     * Creates an error body with timestamp set to now (UTC).
     */
    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now(), Map.of());
    }

    public static ErrorBody of(String error, String message, Map<String, String> details) {
        return new ErrorBody(error, message, Instant.now(), details);
    }
}
