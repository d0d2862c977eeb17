package com.health.misinfo.controller;

import com.health.misinfo.exception.ContextGraphException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@RestControllerAdvice
public class ErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    @ExceptionHandler(ContextGraphException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleRejectedInput(ContextGraphException ex) {
        log.debug("Rejected request: {} {}", ex.getCode(), ex.getMessage());
        return Map.of(
                "code", ex.getCode(),
                "message", ex.getMessage()
        );
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadableBody(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getMostSpecificCause();
        if (cause instanceof ContextGraphException graphEx) {
            return handleRejectedInput(graphEx);
        }
        return Map.of(
                "code", "MALFORMED_REQUEST",
                "message", "Request body could not be read"
        );
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return Map.of(
                "code", "INVALID_PARAMETER",
                "message", "Invalid value for parameter " + ex.getName()
        );
    }
}
