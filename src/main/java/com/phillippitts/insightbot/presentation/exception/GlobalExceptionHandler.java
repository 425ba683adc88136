package com.phillippitts.insightbot.presentation.exception;

import com.phillippitts.insightbot.exception.InvalidSettingException;
import com.phillippitts.insightbot.exception.SessionAlreadyExistsException;
import com.phillippitts.insightbot.exception.SessionCapacityException;
import com.phillippitts.insightbot.exception.SessionNotFoundException;
import com.phillippitts.insightbot.exception.VoiceCaptureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Conflicting start request (HTTP 409).
     */
    @ExceptionHandler(SessionAlreadyExistsException.class)
    ResponseEntity<ApiError> handleSessionExists(SessionAlreadyExistsException ex) {
        LOG.info("Rejected start: guild {} already recording", ex.getGuildId());
        return error(HttpStatus.CONFLICT, ex, "Session already active", ex.getMessage());
    }

    /**
     * Operation on a guild that is not recording (HTTP 404).
     */
    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleSessionNotFound(SessionNotFoundException ex) {
        LOG.info("Rejected request: no session for guild {}", ex.getGuildId());
        return error(HttpStatus.NOT_FOUND, ex, "No active session", ex.getMessage());
    }

    /**
     * Client error - invalid setting value (HTTP 400).
     */
    @ExceptionHandler(InvalidSettingException.class)
    ResponseEntity<ApiError> handleInvalidSetting(InvalidSettingException ex) {
        LOG.warn("Invalid setting: {}={}", ex.getSetting(), ex.getValue());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid setting", ex.getMessage());
    }

    /**
     * Client error - request body failed validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(err -> err.getField() + " " + err.getDefaultMessage())
            .orElse("validation failed");
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", details);
    }

    /**
     * Client error - malformed body or payload (HTTP 400).
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", "Request body could not be processed");
    }

    /**
     * Voice channel could not be joined or no loop capacity left (HTTP 503).
     */
    @ExceptionHandler({VoiceCaptureException.class, SessionCapacityException.class})
    ResponseEntity<ApiError> handleUnavailable(RuntimeException ex) {
        LOG.error("Session could not be started: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Recording unavailable", ex.getMessage());
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
