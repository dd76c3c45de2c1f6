package com.example.triage.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidTransitionException ex) {
        log.warn("Invalid transition: stage={} expected={} received={}",
                ex.getStage(), ex.getExpected(), ex.getReceived());
        return build(HttpStatus.CONFLICT, "Invalid Transition", ex.getMessage());
    }

    @ExceptionHandler(InvalidResponseException.class)
    public ResponseEntity<ErrorResponse> handleInvalidResponse(InvalidResponseException ex) {
        log.warn("Invalid response for question {}: {}", ex.getQuestionId(), ex.getClass().getSimpleName());
        return build(HttpStatus.BAD_REQUEST, "Invalid Response", ex.getMessage());
    }

    @ExceptionHandler(SnapshotRestoreException.class)
    public ResponseEntity<ErrorResponse> handleSnapshotRestore(SnapshotRestoreException ex) {
        log.warn("Snapshot rejected: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Snapshot", ex.getMessage());
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException ex) {
        log.warn(ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "Session Not Found", ex.getMessage());
    }

    @ExceptionHandler(FlowDefectException.class)
    public ResponseEntity<ErrorResponse> handleFlowDefect(FlowDefectException ex) {
        log.error("Flow defect", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Flow Defect", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Request validation failed: {}", message);
        return build(HttpStatus.BAD_REQUEST, "Validation Failed", message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body");
        return build(HttpStatus.BAD_REQUEST, "Malformed Request", "Corpo da requisição inválido");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "Erro inesperado");
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(error)
                .message(message)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
