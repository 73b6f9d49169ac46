package com.walletwatch.api.controller;

import com.walletwatch.api.dto.ErrorBody;
import com.walletwatch.feed.FeedException;
import com.walletwatch.tracking.command.TrackingException;
import com.walletwatch.tracking.store.StoreFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps validation, tracking, store and feed failures to ErrorBody responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, userFacingMessage(error, ex)));
    }

    @ExceptionHandler(TrackingException.class)
    public ResponseEntity<ErrorBody> handleTracking(TrackingException ex) {
        HttpStatus status = TrackingException.INVALID_ADDRESS.equals(ex.getErrorCode())
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(StoreFailureException.class)
    public ResponseEntity<ErrorBody> handleStore(StoreFailureException ex) {
        log.error("Store failure: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of(TrackingException.STORE_FAILURE, "Tracked addresses are temporarily unavailable"));
    }

    @ExceptionHandler(FeedException.class)
    public ResponseEntity<ErrorBody> handleFeed(FeedException ex) {
        log.warn("Lookup failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorBody.feedUnavailable());
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case ErrorBody.INVALID_ADDRESS -> "Invalid wallet address format";
            case ErrorBody.INVALID_LABEL -> "Label must be at most 64 characters and must not contain '/'";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
