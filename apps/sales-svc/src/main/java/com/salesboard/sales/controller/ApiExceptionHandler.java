package com.salesboard.sales.controller;

import com.salesboard.sales.controller.dto.ErrorResponseDto;
import com.salesboard.sales.web.RequestContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponseDto> handleBadParameter(Exception ex) {
        log.warn("Rejected request parameter on {}: {}", requestPath(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", "Invalid request parameter", ex.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(NoResourceFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", "No such endpoint", ex.getMessage());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponseDto> handleMethod(HttpRequestMethodNotSupportedException ex) {
        return build(HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED", "Read-only API", ex.getMessage());
    }

    @ExceptionHandler(CannotGetJdbcConnectionException.class)
    public ResponseEntity<ErrorResponseDto> handleJdbc(CannotGetJdbcConnectionException ex) {
        String specific = ex.getMostSpecificCause().getMessage();
        log.error("Database unavailable on {}: {}", requestPath(), specific, ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "DB_UNAVAILABLE", "Database unavailable", specific);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error on {}", requestPath(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", ex.getMessage());
    }

    private static String requestPath() {
        return RequestContextHolder.get().map(RequestContextHolder.RequestContext::path).orElse("<unknown>");
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, String detail) {
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, detail, traceId));
    }
}
