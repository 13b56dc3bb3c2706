package com.warden.engine.infrastructure.web;

import com.warden.engine.domain.alert.AlertNotFoundException;
import com.warden.engine.domain.metrics.ErrorLogEntry;
import com.warden.engine.domain.metrics.ErrorLogStore;
import com.warden.engine.domain.metrics.MetricsUnavailableException;
import com.warden.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses carrying a timestamp and the
 * correlation id:
 *
 * <pre>
 * {
 *   "type": "https://warden.dev/errors/metrics-unavailable",
 *   "title": "Metrics Unavailable",
 *   "status": 503,
 *   "detail": "System metrics data not available",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Unexpected errors are also written to the error log.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String ERROR_LOG_COMPONENT = "http";

    private final ErrorLogStore errorLog;
    private final Clock clock;

    public GlobalExceptionHandler(ErrorLogStore errorLog, Clock clock) {
        this.errorLog = errorLog;
        this.clock = clock;
    }

    @ExceptionHandler(MetricsUnavailableException.class)
    public ProblemDetail handleMetricsUnavailable(MetricsUnavailableException ex) {
        log.warn("Metrics unavailable: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Metrics Unavailable", "metrics-unavailable", ex.getMessage());
    }

    @ExceptionHandler(AlertNotFoundException.class)
    public ProblemDetail handleAlertNotFound(AlertNotFoundException ex) {
        log.warn("Not found: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.NOT_FOUND, "Alert Not Found", "alert-not-found", ex.getMessage());
        problem.setProperty("alertId", ex.alertId());
        return problem;
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleBadRequest(RuntimeException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        recordError(ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private void recordError(Exception ex) {
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getName();
        try {
            errorLog.record(new ErrorLogEntry(ERROR_LOG_COMPONENT, message, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Failed to record error log entry: {}", e.getMessage());
        }
    }

    private ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://warden.dev/errors/" + type));
        problem.setProperty("timestamp", clock.instant().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
