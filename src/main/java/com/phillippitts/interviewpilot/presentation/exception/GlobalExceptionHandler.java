package com.phillippitts.interviewpilot.presentation.exception;

import com.phillippitts.interviewpilot.exception.IllegalSessionStateException;
import com.phillippitts.interviewpilot.exception.InterviewPilotException;
import com.phillippitts.interviewpilot.exception.InvalidPlanException;
import com.phillippitts.interviewpilot.exception.SessionNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Response bodies never carry candidate answers; upstream failure details stay in the logs.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - rejected plan (HTTP 400).
     */
    @ExceptionHandler(InvalidPlanException.class)
    ResponseEntity<ApiError> handleInvalidPlan(InvalidPlanException ex) {
        LOG.warn("Invalid plan: violations={}", ex.getViolations().size());
        String details = ex.getViolations().isEmpty() ? ex.getMessage() : String.join("; ", ex.getViolations());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid question plan",
                details,
                Instant.now()
            ));
    }

    /**
     * Client error - request body failed bean validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining("; "));
        LOG.warn("Request validation failed: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "ValidationError",
                "Request validation failed",
                details,
                Instant.now()
            ));
    }

    /**
     * Client error - unreadable JSON body (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body");
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "MalformedRequest",
                "Request body could not be read",
                "Check JSON syntax and field types",
                Instant.now()
            ));
    }

    /**
     * Unknown session id (HTTP 404).
     */
    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleSessionNotFound(SessionNotFoundException ex) {
        LOG.debug("Session not found: {}", ex.getSessionId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Session not found",
                ex.getSessionId(),
                Instant.now()
            ));
    }

    /**
     * Control signal not valid in the current phase (HTTP 409).
     */
    @ExceptionHandler(IllegalSessionStateException.class)
    ResponseEntity<ApiError> handleIllegalState(IllegalSessionStateException ex) {
        LOG.info("Rejected control signal: phase={}, reason={}", ex.getPhase(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Operation not allowed in phase " + ex.getPhase(),
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Unknown plan item in an edit request (HTTP 404).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleUnknownItem(IllegalArgumentException ex) {
        LOG.debug("Rejected request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                "NotFound",
                "Referenced item does not exist",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Upstream failure such as an unreachable plan source (HTTP 503).
     */
    @ExceptionHandler(InterviewPilotException.class)
    ResponseEntity<ApiError> handleUpstreamFailure(InterviewPilotException ex) {
        LOG.error("Upstream failure", ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "A dependent service is temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
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
