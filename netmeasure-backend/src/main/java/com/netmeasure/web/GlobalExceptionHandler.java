package com.netmeasure.web;

import com.netmeasure.aggregation.AggregationException;
import com.netmeasure.api.ErrorResponse;
import com.netmeasure.model.ConfigurationException;
import com.netmeasure.result.ResultFormatException;
import com.netmeasure.service.RunNotFoundException;
import com.netmeasure.service.TestNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String TRACE_ID = "trace_id";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Input validation failed", details);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfigurationException(ConfigurationException ex) {
        log.warn("Rejected run configuration: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_CONFIGURATION", ex.getMessage(), null);
    }

    @ExceptionHandler(AggregationException.class)
    public ResponseEntity<ErrorResponse> handleAggregationException(AggregationException ex) {
        log.error("Aggregation failed: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "NO_DATA", ex.getMessage(), null);
    }

    @ExceptionHandler(ResultFormatException.class)
    public ResponseEntity<ErrorResponse> handleResultFormatException(ResultFormatException ex) {
        log.warn("Unable to load result file: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "RESULT_FORMAT_ERROR", ex.getMessage(),
                ex.getCause() == null ? null : ex.getCause().getMessage());
    }

    @ExceptionHandler({TestNotFoundException.class, RunNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleLookupException(RuntimeException ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), null);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not found", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "An unexpected error occurred",
                ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, String details) {
        ErrorResponse error = ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .traceId(MDC.get(TRACE_ID))
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
