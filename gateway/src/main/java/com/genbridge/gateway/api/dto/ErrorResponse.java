package com.genbridge.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body for every non-2xx response.
 *
 * @param error      machine-readable category, e.g. "backend_call"
 * @param message    human-readable description
 * @param rawPayload provider reply behind the failure, when there is one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message, String rawPayload) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, null);
    }
}
