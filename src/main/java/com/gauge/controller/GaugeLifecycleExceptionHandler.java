package com.gauge.controller;

import com.gauge.exception.*;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.OffsetDateTime;

/**
 * Maps lifecycle failures to RFC 7807 problem details.
 *
 * - 409: conflicts with the current state (already paired, identifier reused, checked out, in calibration)
 * - 422: other rejected preconditions
 * - 404: unknown gauge or set
 * - 503: transient storage failures, safe to retry
 * - 500: configuration and storage faults
 */
@RestControllerAdvice
@Slf4j
public class GaugeLifecycleExceptionHandler {

    @ExceptionHandler(GaugeValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(GaugeValidationException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex);
        log.info("Lifecycle request rejected: {} {} (path={})", ex.getCode(), ex.getMessage(), request.getRequestURI());

        ProblemDetail problem = problem(status, "Lifecycle request rejected", ex.getMessage(), ex.getCode(), request);
        if (ex.getField() != null) {
            problem.setProperty("field", ex.getField());
            problem.setProperty("expected", ex.getExpected());
            problem.setProperty("actual", ex.getActual());
        }
        return ResponseEntity.status(status).body(problem);
    }

    @ExceptionHandler(TransientStorageException.class)
    public ResponseEntity<ProblemDetail> handleTransient(TransientStorageException ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
            problem(HttpStatus.SERVICE_UNAVAILABLE, "Temporarily unavailable", ex.getMessage(), "TRANSIENT_STORAGE", request));
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ProblemDetail> handleConfiguration(ConfigurationException ex, HttpServletRequest request) {
        log.error("Configuration error on {}: {}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.internalServerError().body(
            problem(HttpStatus.INTERNAL_SERVER_ERROR, "Configuration error", ex.getMessage(), "CONFIGURATION", request));
    }

    @ExceptionHandler(StorageFailureException.class)
    public ResponseEntity<ProblemDetail> handleStorage(StorageFailureException ex, HttpServletRequest request) {
        return ResponseEntity.internalServerError().body(
            problem(HttpStatus.INTERNAL_SERVER_ERROR, "Storage failure", ex.getMessage(), "STORAGE_FAILURE", request));
    }

    private static HttpStatus statusFor(GaugeValidationException ex) {
        if (ex instanceof GaugeNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof AlreadyPairedException || ex instanceof IdentifierReusedException
            || ex instanceof CheckedOutException || ex instanceof InCalibrationException) {
            return HttpStatus.CONFLICT;
        }
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail, String code,
                                         HttpServletRequest request) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setProperty("code", code);
        problem.setProperty("timestamp", OffsetDateTime.now());
        problem.setProperty("path", request.getRequestURI());
        return problem;
    }
}
