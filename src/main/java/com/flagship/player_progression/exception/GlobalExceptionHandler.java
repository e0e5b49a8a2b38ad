package com.flagship.player_progression.exception;

import com.flagship.player_progression.loot.LootConfigurationException;
import com.flagship.player_progression.observability.CorrelationContext;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Maps failures to status codes and {@link ApiError} bodies.
 *
 * Business failures carry their message to the caller. Storage and
 * unexpected failures are logged in full and answered with a generic body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ProgressionException.class)
    public ResponseEntity<ApiError> handleProgression(ProgressionException e) {
        HttpStatus status = statusFor(e);
        log.info("Request rejected: kind={}, status={}, message={}", e.getKind(), status.value(), e.getMessage());

        String error = e instanceof LootConfigurationException
                ? ((LootConfigurationException) e).getReason().name()
                : e.getKind().name();
        return respond(status, error, e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing,
                TreeMap::new
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(ConstraintViolationException e) {
        log.warn("Parameter validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getConstraintViolations()
            .stream()
            .collect(Collectors.toMap(
                violation -> lastNode(violation.getPropertyPath().toString()),
                violation -> violation.getMessage(),
                (existing, replacement) -> existing,
                TreeMap::new
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiError> handleMethodValidation(HandlerMethodValidationException e) {
        log.warn("Parameter validation failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Malformed parameter {}: {}", e.getName(), e.getValue());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request",
                "Parameter '" + e.getName() + "' has an invalid value", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "Request body is missing or malformed", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> handleNoResource(NoResourceFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "Not Found", "No endpoint " + e.getResourcePath(), null);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiError> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        return respond(HttpStatus.METHOD_NOT_ALLOWED, "Method Not Allowed", e.getMessage(), null);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiError> handleStorageFailure(DataAccessException e) {
        log.error("Storage failure: playerId={}, operation={}, matchId={}",
                MDC.get(CorrelationContext.PLAYER_ID_MDC_KEY), MDC.get(CorrelationContext.OPERATION_MDC_KEY),
                MDC.get(CorrelationContext.MATCH_ID_MDC_KEY), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", null);
    }

    static HttpStatus statusFor(ProgressionException e) {
        return switch (e.getKind()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_OWNED -> HttpStatus.CONFLICT;
            case NOT_OWNED -> HttpStatus.FORBIDDEN;
            case INSUFFICIENT_CURRENCY -> HttpStatus.PAYMENT_REQUIRED;
            case INVALID_STATS -> HttpStatus.BAD_REQUEST;
            case CONFLICT -> HttpStatus.CONFLICT;
            case LOOT_CONFIGURATION -> e instanceof LootConfigurationException
                    && ((LootConfigurationException) e).getReason()
                        == LootConfigurationException.Reason.NO_DROP_FROM_ANY_TABLE
                    ? HttpStatus.NOT_FOUND
                    : HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private static String lastNode(String path) {
        int dot = path.lastIndexOf('.');
        return dot < 0 ? path : path.substring(dot + 1);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String error, String message,
                                             Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }
}
