package com.phillippitts.transcodeguard.presentation.exception;

import com.phillippitts.transcodeguard.exception.AlreadyRunningException;
import com.phillippitts.transcodeguard.exception.EngineException;
import com.phillippitts.transcodeguard.exception.IllegalTransitionException;
import com.phillippitts.transcodeguard.exception.JobNotFoundException;
import com.phillippitts.transcodeguard.exception.OperationTimeoutException;
import com.phillippitts.transcodeguard.exception.TranscodeGuardException;
import com.phillippitts.transcodeguard.exception.ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Engine and process details are logged but not echoed to clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Single-job slot is occupied (HTTP 409).
     */
    @ExceptionHandler(AlreadyRunningException.class)
    ResponseEntity<ApiError> handleAlreadyRunning(AlreadyRunningException ex) {
        LOG.info("Submission rejected: job {} is active", ex.getActiveJobId());
        return error(HttpStatus.CONFLICT, ex, "A conversion is already in progress",
                "Active job: " + ex.getActiveJobId());
    }

    /**
     * Pre-flight check failed (HTTP 422).
     */
    @ExceptionHandler(ValidationException.class)
    ResponseEntity<ApiError> handleValidation(ValidationException ex) {
        LOG.warn("Validation failed: failure={}, detail={}", ex.getFailure(), ex.getDetail());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex, ex.getFailure().description(), ex.getDetail());
    }

    @ExceptionHandler(JobNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(JobNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex, "Job not found", "No job with id " + ex.getJobId());
    }

    @ExceptionHandler(IllegalTransitionException.class)
    ResponseEntity<ApiError> handleIllegalTransition(IllegalTransitionException ex) {
        LOG.warn("Rejected {} for job {} in state {}", ex.getEvent(), ex.getJobId(), ex.getFrom());
        return error(HttpStatus.CONFLICT, ex, "Command not allowed in current state",
                ex.getEvent() + " from " + ex.getFrom());
    }

    /**
     * Transient error - retry possible (HTTP 504).
     */
    @ExceptionHandler(OperationTimeoutException.class)
    ResponseEntity<ApiError> handleTimeout(OperationTimeoutException ex) {
        LOG.warn("Operation {} timed out after {}", ex.getOperation(), ex.getTimeout());
        return error(HttpStatus.GATEWAY_TIMEOUT, ex, "Operation timed out", ex.getOperation().name());
    }

    /**
     * Codec engine could not start the job (HTTP 502).
     */
    @ExceptionHandler(EngineException.class)
    ResponseEntity<ApiError> handleEngine(EngineException ex) {
        LOG.error("Engine failure: code={}", ex.getCode(), ex);
        return error(HttpStatus.BAD_GATEWAY, ex, "Conversion engine unavailable", ex.getCode());
    }

    @ExceptionHandler(TranscodeGuardException.class)
    ResponseEntity<ApiError> handleDomain(TranscodeGuardException ex) {
        LOG.error("Conversion request failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex, "Conversion request failed", ex.getMessage());
    }

    /**
     * Malformed request body.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", details);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleIllegalState(IllegalStateException ex) {
        return error(HttpStatus.CONFLICT, ex, "Request conflicts with current state", ex.getMessage());
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
