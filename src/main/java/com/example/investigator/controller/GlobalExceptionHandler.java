package com.example.investigator.controller;

import com.example.investigator.service.InvalidRequestException;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException e) {
        String message =
                e.getBindingResult().getFieldErrors().stream()
                        .map(error -> error.getField() + " " + error.getDefaultMessage())
                        .sorted()
                        .collect(Collectors.joining(", "));
        return badRequest(message.isEmpty() ? "invalid request" : message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException e) {
        return badRequest("Malformed request body");
    }

    @ExceptionHandler({InvalidRequestException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, String>> handleInvalid(Exception e) {
        return badRequest(e.getMessage() == null ? "invalid request" : e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception e) {
        // Framework errors (unknown path, wrong method) keep their own status
        if (e instanceof ErrorResponse response && response.getStatusCode().is4xxClientError()) {
            return ResponseEntity.status(response.getStatusCode())
                    .body(Map.of("error", "invalid_request", "message", String.valueOf(e.getMessage())));
        }
        log.error("Unexpected failure while handling request", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "internal_error", "message", "Investigation failed"));
    }

    static ResponseEntity<Map<String, String>> badRequest(String message) {
        log.warn("Rejected request: {}", message);
        return ResponseEntity.badRequest()
                .body(Map.of("error", "invalid_request", "message", message));
    }
}
