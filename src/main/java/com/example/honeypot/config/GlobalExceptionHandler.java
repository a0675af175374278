package com.example.honeypot.config;

import com.example.honeypot.controller.dto.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ChatResponse> handleValidation(WebExchangeBindException ex) {
        String detail = ex.getBindingResult().getAllErrors().stream()
                .map(error -> error instanceof FieldError
                        ? ((FieldError) error).getField() + ": " + error.getDefaultMessage()
                        : error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        logger.warn("Rejected malformed request: {}", detail);
        return ResponseEntity.badRequest().body(ChatResponse.error(detail));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ChatResponse> handleUnreadable(ServerWebInputException ex) {
        logger.warn("Rejected unreadable request: {}", ex.getReason());
        return ResponseEntity.badRequest().body(ChatResponse.error(
                ex.getReason() != null ? ex.getReason() : "Malformed request body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ChatResponse> handleUnexpected(Exception ex) {
        logger.error("Unhandled error while processing request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ChatResponse.error("Internal error"));
    }
}
