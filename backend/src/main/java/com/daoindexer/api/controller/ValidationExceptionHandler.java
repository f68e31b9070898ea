package com.daoindexer.api.controller;

import com.daoindexer.api.dto.ErrorBody;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps request binding failures to 400 with ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
public class ValidationExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String message = Optional.ofNullable(ex.getFieldError())
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of("VALIDATION_ERROR", message));
    }

    /** Missing or unparsable query/path parameters. */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        String message = Optional.ofNullable(ex.getMethodParameter())
                .map(p -> p.getParameterName() + ": " + Optional.ofNullable(ex.getReason()).orElse("invalid value"))
                .orElseGet(() -> Optional.ofNullable(ex.getReason()).orElse("Invalid request"));
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", message));
    }
}
