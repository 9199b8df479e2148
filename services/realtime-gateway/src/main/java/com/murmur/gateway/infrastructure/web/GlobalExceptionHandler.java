package com.murmur.gateway.infrastructure.web;

import com.murmur.eventbus.log.EventLogException;
import com.murmur.eventmodel.InvalidEventException;
import com.murmur.eventmodel.versioning.VersionGapException;
import com.murmur.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses carrying a timestamp and the
 * request's correlation id.
 *
 * <pre>
 * {
 *   "type": "https://murmur.dev/errors/event-log-unavailable",
 *   "title": "Event Log Unavailable",
 *   "status": 503,
 *   "detail": "Failed to read aggregate conv-1",
 *   "timestamp": "2026-03-02T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String ERROR_TYPE_BASE = "https://murmur.dev/errors/";

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(InvalidEventException.class)
    public ProblemDetail handleInvalidEvent(InvalidEventException ex) {
        log.warn("Rejected invalid event {}: {}", ex.eventId(), ex.errors());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Invalid Event", "invalid-event", ex.getMessage());
        problem.setProperty("errors", ex.errors());
        return problem;
    }

    @ExceptionHandler(VersionGapException.class)
    public ProblemDetail handleVersionGap(VersionGapException ex) {
        log.warn("Version gap: {}", ex.getMessage());
        ProblemDetail problem =
                problem(HttpStatus.UNPROCESSABLE_ENTITY, "Version Gap", "version-gap", ex.getMessage());
        problem.setProperty("eventType", ex.eventType());
        problem.setProperty("missingHopFrom", ex.missingHopFrom());
        return problem;
    }

    @ExceptionHandler(EventLogException.class)
    public ProblemDetail handleEventLog(EventLogException ex) {
        log.error("Event log unavailable", ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Event Log Unavailable", "event-log-unavailable",
                ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.currentCorrelationId()
                .ifPresent(correlationId -> problem.setProperty("correlationId", correlationId));
        return problem;
    }
}
