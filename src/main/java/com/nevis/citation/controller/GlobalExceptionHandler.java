package com.nevis.citation.controller;

import com.nevis.citation.exception.AnalysisUnavailableException;
import com.nevis.citation.exception.DuplicateJobException;
import com.nevis.citation.exception.EntityNotFoundException;
import com.nevis.citation.exception.IncompleteAnalysisException;
import com.nevis.citation.exception.InvalidElementException;
import com.nevis.citation.exception.MissingRequestContextException;
import com.nevis.citation.exception.ReferenceUnavailableException;
import com.nevis.citation.exception.TenantMismatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, new ErrorResponse(ex.getMessage(), HttpStatus.NOT_FOUND.value()));
    }

    @ExceptionHandler(DuplicateJobException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateJob(DuplicateJobException ex) {
        ErrorResponse error = new ErrorResponse(
            ex.getMessage(),
            HttpStatus.CONFLICT.value(),
            Map.of(
                "existing_job_id", ex.getExistingJob().id(),
                "existing_job_status", ex.getExistingJob().status()
            )
        );
        return respond(HttpStatus.CONFLICT, error);
    }

    @ExceptionHandler(IncompleteAnalysisException.class)
    public ResponseEntity<ErrorResponse> handleIncompleteAnalysis(IncompleteAnalysisException ex) {
        ErrorResponse error = new ErrorResponse(
            ex.getMessage(),
            HttpStatus.CONFLICT.value(),
            Map.of(
                "missing_references", ex.getMissingReferences(),
                "stale_references", ex.getStaleReferences()
            )
        );
        return respond(HttpStatus.CONFLICT, error);
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateKey(DuplicateKeyException ex) {
        return respond(HttpStatus.CONFLICT, new ErrorResponse("Duplicate entity", HttpStatus.CONFLICT.value()));
    }

    @ExceptionHandler(InvalidElementException.class)
    public ResponseEntity<ErrorResponse> handleInvalidElement(InvalidElementException ex) {
        ErrorResponse error = new ErrorResponse(
            ex.getMessage(),
            HttpStatus.BAD_REQUEST.value(),
            Map.of("element_id", ex.getElementId())
        );
        return respond(HttpStatus.BAD_REQUEST, error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + " " + e.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, new ErrorResponse(message, HttpStatus.BAD_REQUEST.value()));
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException ex) {
        return respond(HttpStatus.BAD_REQUEST, new ErrorResponse("Invalid request parameters", HttpStatus.BAD_REQUEST.value()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParams(MissingServletRequestParameterException ex) {
        String message = String.format("Parameter '%s' is missing", ex.getParameterName());
        return respond(HttpStatus.BAD_REQUEST, new ErrorResponse(message, HttpStatus.BAD_REQUEST.value()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = String.format("Parameter '%s' has an invalid value", ex.getName());
        return respond(HttpStatus.BAD_REQUEST, new ErrorResponse(message, HttpStatus.BAD_REQUEST.value()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        String message = ex instanceof HttpMessageNotReadableException ? "Malformed request body" : ex.getMessage();
        return respond(HttpStatus.BAD_REQUEST, new ErrorResponse(message, HttpStatus.BAD_REQUEST.value()));
    }

    @ExceptionHandler(MissingRequestContextException.class)
    public ResponseEntity<ErrorResponse> handleMissingContext(MissingRequestContextException ex) {
        return respond(HttpStatus.UNAUTHORIZED, new ErrorResponse(ex.getMessage(), HttpStatus.UNAUTHORIZED.value()));
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTenantMismatch(TenantMismatchException ex) {
        return respond(HttpStatus.FORBIDDEN, new ErrorResponse(ex.getMessage(), HttpStatus.FORBIDDEN.value()));
    }

    @ExceptionHandler({ReferenceUnavailableException.class, AnalysisUnavailableException.class})
    public ResponseEntity<ErrorResponse> handleUpstreamUnavailable(RuntimeException ex) {
        log.warn("Upstream analysis unavailable: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, new ErrorResponse(ex.getMessage(), HttpStatus.BAD_GATEWAY.value()));
    }

    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<ErrorResponse> handleSaturated(TaskRejectedException ex) {
        log.warn("Rejected request, executor saturated: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE,
            new ErrorResponse("Too many analyses in progress, retry later", HttpStatus.SERVICE_UNAVAILABLE.value()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled request failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
            new ErrorResponse("An unexpected error occurred", HttpStatus.INTERNAL_SERVER_ERROR.value()));
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorResponse error) {
        return new ResponseEntity<>(error, status);
    }
}
