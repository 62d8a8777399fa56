package com.axiom.gateway.infrastructure.web;

import com.axiom.gateway.domain.error.AdmissionDeniedException;
import com.axiom.gateway.domain.error.AxiomException;
import com.axiom.gateway.domain.error.ErrorCode;
import com.axiom.gateway.domain.error.RateLimitedException;
import com.axiom.observability.CorrelationContext;
import com.axiom.observability.CorrelationContextHolder;
import com.axiom.security.AuthenticationException;
import com.axiom.security.AuthorizationException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to the {@link ErrorResponse} envelope. Every envelope carries the request's
 * correlation ID when one is active.
 *
 * <p>Admission denials are expected outcomes and are not logged here; the admission pipeline
 * already logs them at INFO.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthentication(AuthenticationException ex) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        return respond(ErrorCode.UNAUTHORIZED, ex.getMessage(), null, null, headers);
    }

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ErrorResponse> handleAuthorization(AuthorizationException ex) {
        return respond(ErrorCode.FORBIDDEN, ex.getMessage(), null, null, null);
    }

    @ExceptionHandler(AdmissionDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAdmissionDenied(AdmissionDeniedException ex) {
        HttpHeaders headers = new HttpHeaders();
        if (ex instanceof RateLimitedException limited) {
            headers.addAll(RateLimitHeaders.of(limited.decision()));
        }
        Duration retryAfter = ex.retryAfter();
        if (retryAfter != null) {
            headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, (retryAfter.toMillis() + 999) / 1000)));
        }
        return respond(ex.errorCode(), ex.getMessage(), ex.details(),
                retryAfter != null ? retryAfter.toMillis() : null, headers);
    }

    @ExceptionHandler(AxiomException.class)
    public ResponseEntity<ErrorResponse> handleAxiom(AxiomException ex) {
        switch (ex.errorCode()) {
            case DATABASE_ERROR, INTERNAL_ERROR -> log.error("Request failed: {}", ex.getMessage(), ex);
            case AI_SERVICE_UNAVAILABLE -> log.warn("Upstream unavailable: {}", ex.getMessage());
            case INTEGRITY_VIOLATION -> log.error("Integrity violation: {}", ex.details());
            default -> log.debug("Request rejected: {} {}", ex.errorCode(), ex.getMessage());
        }
        return respond(ex.errorCode(), ex.getMessage(), ex.details(), null, null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, Object> fields = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(fe -> fields.putIfAbsent(fe.getField(), fe.getDefaultMessage()));
        log.debug("Validation failed: {}", fields);
        return respond(ErrorCode.VALIDATION_ERROR, "request validation failed", fields, null, null);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        log.debug("Bad request: {}", ex.getMessage());
        String message = ex instanceof HttpMessageNotReadableException ? "malformed request body" : ex.getMessage();
        return respond(ErrorCode.BAD_REQUEST, message, null, null, null);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(envelope(ErrorCode.BAD_REQUEST, ex.getMessage(), null, null));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        return respond(ErrorCode.NOT_FOUND, "resource not found", null, null, null);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException ex) {
        log.error("Database error", ex);
        return respond(ErrorCode.DATABASE_ERROR, "database error", null, null, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return respond(ErrorCode.INTERNAL_ERROR, "an unexpected error occurred", null, null, null);
    }

    private static ResponseEntity<ErrorResponse> respond(ErrorCode code, String message, Map<String, Object> details,
                                                         Long retryAfterMs, HttpHeaders headers) {
        return ResponseEntity.status(code.httpStatus())
                .headers(headers)
                .body(envelope(code, message, details, retryAfterMs));
    }

    static ErrorResponse envelope(ErrorCode code, String message, Map<String, Object> details, Long retryAfterMs) {
        String correlationId = CorrelationContextHolder.get()
                .map(CorrelationContext::correlationId)
                .orElse(null);
        return new ErrorResponse(new ErrorResponse.Body(code.name(), message,
                details == null || details.isEmpty() ? null : details, retryAfterMs, correlationId));
    }
}
