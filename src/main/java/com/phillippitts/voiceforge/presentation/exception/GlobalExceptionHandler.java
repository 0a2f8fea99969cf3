package com.phillippitts.voiceforge.presentation.exception;

import com.phillippitts.voiceforge.domain.TaskResult;
import com.phillippitts.voiceforge.exception.SessionProtocolException;
import com.phillippitts.voiceforge.exception.TaskFailedException;
import com.phillippitts.voiceforge.exception.UnknownTaskTypeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.Map;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Task could not produce a result (HTTP 503). The body follows the task result contract.
     */
    @ExceptionHandler(TaskFailedException.class)
    ResponseEntity<Map<String, Object>> handleTaskFailed(TaskFailedException ex) {
        LOG.warn("Task failed: id={}, type={}, kind={}: {}",
                ex.getTaskId(), ex.getTaskType(), ex.getKind(), ex.getMessage());
        String id = ex.getTaskId() == null ? "" : ex.getTaskId();
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(TaskResult.failure(id, ex.getKind(), ex.getMessage()).toJson().toMap());
    }

    /**
     * No pool serves the requested type (HTTP 404).
     */
    @ExceptionHandler(UnknownTaskTypeException.class)
    ResponseEntity<ApiError> handleUnknownType(UnknownTaskTypeException ex) {
        LOG.warn("Unknown task type requested: {}", ex.getTaskType());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                "UNKNOWN_TASK_TYPE",
                "No worker pool for task type",
                ex.getMessage(),
                Instant.now()
            ));
    }

    @ExceptionHandler(SessionProtocolException.class)
    ResponseEntity<ApiError> handleProtocol(SessionProtocolException ex) {
        LOG.warn("Protocol violation: {} {}", ex.getKind(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(ex.getKind().name(), "Protocol violation", ex.getMessage(), Instant.now()));
    }

    /**
     * Malformed request body or submission fields (HTTP 400).
     */
    @ExceptionHandler({JSONException.class, IllegalArgumentException.class})
    ResponseEntity<ApiError> handleBadRequest(RuntimeException ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("BAD_REQUEST", "Invalid request", ex.getMessage(), Instant.now()));
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
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
