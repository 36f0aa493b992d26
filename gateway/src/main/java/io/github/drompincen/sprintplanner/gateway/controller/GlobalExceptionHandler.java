package io.github.drompincen.sprintplanner.gateway.controller;

import io.github.drompincen.sprintplanner.protocol.api.ErrorKind;
import io.github.drompincen.sprintplanner.protocol.api.ErrorResponse;
import io.github.drompincen.sprintplanner.runtime.error.PlannerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(PlannerException.class)
    protected ResponseEntity<ErrorResponse> handlePlannerException(PlannerException e) {
        HttpStatus status = statusOf(e.getKind());
        log.warn("Planner failure: {} | Message: {}", e.getKind(), e.getMessage());
        Map<String, Object> details = e.getDetails().isEmpty() ? null : e.getDetails();
        return ResponseEntity.status(status).body(new ErrorResponse(e.getKind(), status.getReasonPhrase(),
                e.getMessage(), e.getRemediation(), details, Instant.now()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    protected ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(ErrorKind.VALIDATION_FAILURE,
                HttpStatus.BAD_REQUEST.getReasonPhrase(), "Malformed request body",
                "Send a JSON body matching the endpoint's request shape", null, Instant.now()));
    }

    /** Unexpected failures: full stack trace in the log, generic message on the wire. */
    @ExceptionHandler(Exception.class)
    protected ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected failure: ", e);
        return ResponseEntity.internalServerError().body(new ErrorResponse(ErrorKind.INTERNAL,
                HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase(), "Internal server error",
                null, null, Instant.now()));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case REMOTE_QUERY_FAILURE -> HttpStatus.BAD_GATEWAY;
            case VALIDATION_FAILURE -> HttpStatus.BAD_REQUEST;
            case CONFLICT -> HttpStatus.CONFLICT;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
