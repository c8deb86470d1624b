package com.openforge.memgraph.api;

import com.openforge.memgraph.error.CollaboratorUnavailableException;
import com.openforge.memgraph.error.InvariantViolationException;
import com.openforge.memgraph.error.MalformedResponseException;
import com.openforge.memgraph.error.NodeNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the core's typed errors onto HTTP statuses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    public record ErrorResponse(String error, String message) {}

    @ExceptionHandler(NodeNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(NodeNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ErrorResponse> invariant(InvariantViolationException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "invariant_violation", e.getMessage());
    }

    @ExceptionHandler(CollaboratorUnavailableException.class)
    public ResponseEntity<ErrorResponse> unavailable(CollaboratorUnavailableException e) {
        log.warn("[API] {} unavailable (namespace={}, op={}): {}",
                e.getCollaborator(), e.getNamespace(), e.getOperation(), e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "collaborator_unavailable", e.getMessage());
    }

    @ExceptionHandler(MalformedResponseException.class)
    public ResponseEntity<ErrorResponse> malformed(MalformedResponseException e) {
        return respond(HttpStatus.BAD_GATEWAY, "malformed_response", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .findFirst()
                .orElse("invalid request");
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", message);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, message));
    }
}
