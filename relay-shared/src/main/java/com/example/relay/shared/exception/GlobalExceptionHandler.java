package com.example.relay.shared.exception;

import com.example.relay.shared.dto.ErrorResponse;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

import java.time.OffsetDateTime;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(ResourceNotFoundException ex, ServerWebExchange exchange) {
        log.warn("ResourceNotFoundException: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), exchange);
    }

    @ExceptionHandler(InvalidOrExpiredCodeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidOrExpiredCode(InvalidOrExpiredCodeException ex, ServerWebExchange exchange) {
        log.warn("Pairing code rejected: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Pairing Code", ex.getMessage(), exchange);
    }

    @ExceptionHandler(AuthFailureException.class)
    public ResponseEntity<ErrorResponse> handleAuthFailure(AuthFailureException ex, ServerWebExchange exchange) {
        log.warn("{} on path '{}': {}", ex.getClass().getSimpleName(), exchange.getRequest().getPath(), ex.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, "Unauthorized", ex.getMessage(), exchange);
    }

    @ExceptionHandler(PairingCodeAlreadyIssuedException.class)
    public ResponseEntity<ErrorResponse> handlePairingCodeAlreadyIssued(PairingCodeAlreadyIssuedException ex, ServerWebExchange exchange) {
        log.warn("PairingCodeAlreadyIssuedException: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), exchange);
    }

    @ExceptionHandler(UnknownCommandException.class)
    public ResponseEntity<ErrorResponse> handleUnknownCommand(UnknownCommandException ex, ServerWebExchange exchange) {
        log.warn("UnknownCommandException: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), exchange);
    }

    @ExceptionHandler(RequestNotPermitted.class)
    public ResponseEntity<ErrorResponse> handleRateLimited(RequestNotPermitted ex, ServerWebExchange exchange) {
        log.warn("Rate limit hit on path '{}': {}", exchange.getRequest().getPath(), ex.getMessage());
        return respond(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", "Too many requests. Please try again later.", exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(WebExchangeBindException ex, ServerWebExchange exchange) {
        String errors = ex.getBindingResult()
                .getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", errors, exchange);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, ServerWebExchange exchange) {
        log.warn("Bad request on path '{}': {}", exchange.getRequest().getPath(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex, ServerWebExchange exchange) {
        if (ex.getStatusCode().is4xxClientError()) {
            log.warn("Client error: {} on path '{}' - Reason: {}", ex.getStatusCode().value(), exchange.getRequest().getPath(), ex.getReason());
        } else if (ex.getStatusCode().is5xxServerError()) {
            log.error("Server error occurred on path {}:", exchange.getRequest().getPath(), ex);
        }
        ErrorResponse errorResponse = new ErrorResponse(
                OffsetDateTime.now(),
                ex.getStatusCode().value(),
                ex.getStatusCode().toString(),
                ex.getReason(),
                exchange.getRequest().getPath().toString()
        );
        return new ResponseEntity<>(errorResponse, ex.getStatusCode());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("An unexpected error occurred at path {}:", exchange.getRequest().getPath(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", exchange);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message, ServerWebExchange exchange) {
        ErrorResponse errorResponse = new ErrorResponse(
                OffsetDateTime.now(),
                status.value(),
                error,
                message,
                exchange.getRequest().getPath().toString()
        );
        return new ResponseEntity<>(errorResponse, status);
    }
}
