package com.github.dimitryivaniuta.egress.web;

import com.github.dimitryivaniuta.egress.error.OutboundCallException;
import com.github.dimitryivaniuta.egress.error.RequestTimeoutException;
import com.github.dimitryivaniuta.egress.error.ServiceShutdownException;
import com.github.dimitryivaniuta.egress.error.UpstreamRateLimitException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.NoSuchElementException;

import static com.github.dimitryivaniuta.egress.web.RequestContextKeys.CORRELATION_ID_MDC_KEY;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    public record ApiError(
            Instant timestamp,
            int status,
            String error,
            String message,
            String path,
            String correlationId,
            String provider
    ) {}

    @ExceptionHandler(UpstreamRateLimitException.class)
    public ResponseEntity<ApiError> handleRateLimit(UpstreamRateLimitException ex, HttpServletRequest req) {
        HttpHeaders h = new HttpHeaders();
        h.set(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(0, ex.getRetryAfterSeconds())));
        ApiError body = error(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage(), req, ex.getProvider());
        return new ResponseEntity<>(body, h, HttpStatus.TOO_MANY_REQUESTS);
    }

    @ExceptionHandler(RequestTimeoutException.class)
    public ResponseEntity<ApiError> handleTimeout(RequestTimeoutException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(error(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage(), req, ex.getProvider()));
    }

    @ExceptionHandler(ServiceShutdownException.class)
    public ResponseEntity<ApiError> handleShutdown(ServiceShutdownException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(error(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), req, ex.getProvider()));
    }

    /**
     * Remaining upstream failures: the provider, not the caller, is at fault.
     */
    @ExceptionHandler(OutboundCallException.class)
    public ResponseEntity<ApiError> handleUpstream(OutboundCallException ex, HttpServletRequest req) {
        log.warn("Upstream call to {} failed: {}", ex.getProvider(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(error(HttpStatus.BAD_GATEWAY, ex.getMessage(), req, ex.getProvider()));
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiError> handleNotFound(NoSuchElementException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(error(HttpStatus.NOT_FOUND, ex.getMessage(), req, null));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleRse(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return ResponseEntity.status(status).body(error(status, ex.getReason(), req, null));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class,
            MissingServletRequestParameterException.class, ConstraintViolationException.class,
            HandlerMethodValidationException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiError> handleValidation(Exception ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error(HttpStatus.BAD_REQUEST, "Validation failed: " + ex.getMessage(), req, null));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> noResource(NoResourceFoundException ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(error(HttpStatus.NOT_FOUND, ex.getMessage(), request, null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", req, null));
    }

    private ApiError error(HttpStatus status, String message, HttpServletRequest req, String provider) {
        return new ApiError(
                Instant.now(),
                status.value(),
                status.getReasonPhrase(),
                (message == null || message.isBlank()) ? status.getReasonPhrase() : message,
                req.getRequestURI(),
                MDC.get(CORRELATION_ID_MDC_KEY),
                provider
        );
    }
}
