package com.genbridge.gateway.api;

import com.genbridge.gateway.api.dto.ErrorResponse;
import com.genbridge.gateway.error.BackendCallException;
import com.genbridge.gateway.error.ConfigurationException;
import com.genbridge.gateway.error.EmptyResultException;
import com.genbridge.gateway.error.GenerationException;
import com.genbridge.gateway.error.ResponseParseException;
import com.genbridge.gateway.error.TerminalTaskFailureException;
import com.genbridge.gateway.registry.ComponentNotFoundException;
import com.genbridge.gateway.registry.InvalidComponentInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps generation failures onto HTTP statuses.
 *
 * 400  malformed body, input that does not bind, blank task id
 * 404  unknown component
 * 422  task ended FAILED / CANCELED
 * 500  missing configuration (API key)
 * 502  provider rejected the call, answered unparseably, or succeeded with nothing
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<ErrorResponse> generationFailed(GenerationException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.error("Generation call failed [{}]: {}", e.category(), e.getMessage());
        } else {
            log.warn("Generation call failed [{}]: {}", e.category(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.category(), e.getMessage(), e.rawPayload()));
    }

    @ExceptionHandler(ComponentNotFoundException.class)
    public ResponseEntity<ErrorResponse> componentNotFound(ComponentNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of("not_found", e.getMessage()));
    }

    @ExceptionHandler({InvalidComponentInputException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> invalidInput(RuntimeException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("invalid_input", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("invalid_input", "Request body is not valid JSON"));
    }

    static HttpStatus statusOf(GenerationException e) {
        if (e instanceof ConfigurationException)       return HttpStatus.INTERNAL_SERVER_ERROR;
        if (e instanceof TerminalTaskFailureException) return HttpStatus.UNPROCESSABLE_ENTITY;
        if (e instanceof BackendCallException
                || e instanceof ResponseParseException
                || e instanceof EmptyResultException)  return HttpStatus.BAD_GATEWAY;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
