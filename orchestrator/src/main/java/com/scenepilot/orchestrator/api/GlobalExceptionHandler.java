package com.scenepilot.orchestrator.api;

import com.scenepilot.orchestrator.api.dto.ApiError;
import com.scenepilot.orchestrator.error.InvalidTransitionException;
import com.scenepilot.orchestrator.error.NotFoundException;
import com.scenepilot.orchestrator.error.OrchestrationException;
import com.scenepilot.orchestrator.error.TasksInFlightException;
import com.scenepilot.orchestrator.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Maps orchestration errors to {@link ApiError} bodies.
 *
 * Validation -> 400, NotFound -> 404, InvalidTransition / TasksInFlight -> 409.
 * Storage and exhausted state conflicts are server-side faults -> 500.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({InvalidTransitionException.class, TasksInFlightException.class})
    public ResponseEntity<ApiError> handleConflict(OrchestrationException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(OrchestrationException.class)
    public ResponseEntity<ApiError> handleOther(OrchestrationException e) {
        log.error("{}: {}", e.code(), e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleBeanValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(new ApiError("ValidationError", message));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception e) {
        return ResponseEntity.badRequest().body(new ApiError("ValidationError", "Malformed request: " + e.getMessage()));
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, OrchestrationException e) {
        log.debug("{} -> {}: {}", e.code(), status.value(), e.getMessage());
        return ResponseEntity.status(status).body(new ApiError(e.code(), e.getMessage()));
    }
}
