package com.resumecontrol.exception;

import com.resumecontrol.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 *
 * Maps each failure kind to one status: unauthenticated 401, invalid argument
 * 400, not found 404, conflict 409, store failure 500. Store failures never
 * expose driver messages.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResourceNotFound(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage(), null);
    }

    @ExceptionHandler(ConflictException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleConflict(ConflictException ex) {
        log.warn("Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "conflict", ex.getMessage(), ex.getConflictingId());
    }

    @ExceptionHandler(InvalidArgumentException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidArgument(InvalidArgumentException ex) {
        log.warn("Invalid argument '{}': {}", ex.getField(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "invalid_argument", ex.getMessage(), null);
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleUnauthenticated(UnauthenticatedException ex) {
        log.warn("Unauthenticated request: {}", ex.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, "unauthenticated", ex.getMessage(), null);
    }

    @ExceptionHandler(StoreException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleStoreFailure(StoreException ex) {
        log.error("Store failure: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "Internal server error", null);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, "invalid_argument", "Validation failed: " + errors, null);
    }

    /**
     * Unreadable bodies and path or query values of the wrong type.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(ServerWebInputException ex) {
        log.warn("Malformed request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, "invalid_argument",
                ex.getReason() != null ? ex.getReason() : "Malformed request", null);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatusCode status = ex.getStatusCode();
        log.warn("Request failed with status {}: {}", status.value(), ex.getReason());
        return respond(status, status.is4xxClientError() ? "client_error" : "internal",
                ex.getReason() != null ? ex.getReason() : ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "Internal server error", null);
    }

    private static Mono<ResponseEntity<ErrorResponse>> respond(HttpStatusCode status, String kind,
                                                               String detail, Long conflictingId) {
        ErrorResponse error = ErrorResponse.builder()
                .error(kind)
                .detail(detail)
                .conflictingId(conflictingId)
                .traceId(UUID.randomUUID().toString())
                .build();
        return Mono.just(ResponseEntity.status(status).body(error));
    }
}
