package com.factory.stockkeeper.config;

import com.factory.stockkeeper.exception.ConcurrencyConflictException;
import com.factory.stockkeeper.exception.InsufficientStockException;
import com.factory.stockkeeper.exception.InvalidStateTransitionException;
import com.factory.stockkeeper.exception.ManufacturingException;
import com.factory.stockkeeper.exception.NotFoundException;
import com.factory.stockkeeper.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the manufacturing error taxonomy onto HTTP statuses with one JSON error body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, e, null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e, null);
    }

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientStock(InsufficientStockException e) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("materialId", String.valueOf(e.getMaterialId()));
        details.put("warehouseId", String.valueOf(e.getWarehouseId()));
        details.put("requested", e.getRequested().toPlainString());
        details.put("available", e.getAvailable().toPlainString());
        return respond(HttpStatus.CONFLICT, e, details);
    }

    @ExceptionHandler(InvalidStateTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(InvalidStateTransitionException e) {
        return respond(HttpStatus.CONFLICT, e, null);
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ResponseEntity<ErrorResponse> handleConcurrency(ConcurrencyConflictException e) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e, null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBeanValidation(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        error -> error.getField(),
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing));

        ErrorResponse error = ErrorResponse.builder()
                .error("VALIDATION_FAILED")
                .message("Request validation failed")
                .details(errors)
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({ MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class })
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception e) {
        log.warn("Bad request parameter: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
                .error("VALIDATION_FAILED")
                .message(e.getMessage())
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
                .error("INTERNAL_ERROR")
                .message("An unexpected error occurred")
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, ManufacturingException e,
            Map<String, String> details) {
        log.warn("{}: {}", e.getErrorCode(), e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
                .error(e.getErrorCode())
                .message(e.getMessage())
                .details(details)
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(error);
    }

    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
